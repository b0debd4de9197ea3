package com.floodsampler.service.runtime;

import com.floodsampler.sources.api.SourceException;

import java.time.Duration;
import java.util.function.Supplier;

public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, multiplier, maxBackoff, Thread::sleep);
    }

    RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> Attempted<T> call(Supplier<T> action, RetryListener listener) {
        long delayMillis = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return new Attempted<>(action.get(), attempt);
            } catch (SourceException e) {
                if (!e.retryable() || attempt >= maxAttempts) {
                    throw new RetriesExhaustedException(e, attempt);
                }
                listener.onRetry(attempt, e, Duration.ofMillis(delayMillis));
                pause(delayMillis, e, attempt);
                delayMillis = Math.min(maxBackoff.toMillis(), (long) (delayMillis * multiplier));
            }
        }
    }

    private void pause(long millis, SourceException cause, int attempt) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException(cause, attempt);
        }
    }

    public record Attempted<T>(T value, int attempts) {
    }

    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, SourceException error, Duration backoff);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public static final class RetriesExhaustedException extends RuntimeException {
        private final int attempts;

        RetriesExhaustedException(SourceException last, int attempts) {
            super(last.getMessage(), last);
            this.attempts = attempts;
        }

        public SourceException lastFailure() {
            return (SourceException) getCause();
        }

        public int attempts() {
            return attempts;
        }
    }
}

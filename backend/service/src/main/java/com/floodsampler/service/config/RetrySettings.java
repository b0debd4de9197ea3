package com.floodsampler.service.config;

import com.floodsampler.service.runtime.RetryPolicy;

import java.time.Duration;

public record RetrySettings(Integer maxAttempts, Duration initialBackoff, Double multiplier, Duration maxBackoff) {
    public RetrySettings {
        maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        initialBackoff = initialBackoff == null ? Duration.ofSeconds(2) : initialBackoff;
        multiplier = multiplier == null ? 2.0 : multiplier;
        maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
    }

    public static RetrySettings defaults() {
        return new RetrySettings(null, null, null, null);
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
    }
}

package com.floodsampler.core.events;

import java.time.Instant;

public record FetchFailed(
        Instant timestamp,
        String source,
        String fetchKey,
        boolean retryable,
        int attempts,
        String message
) implements Event {
    @Override
    public String type() {
        return "FetchFailed";
    }
}

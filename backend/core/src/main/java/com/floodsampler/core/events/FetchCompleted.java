package com.floodsampler.core.events;

import java.time.Instant;

public record FetchCompleted(
        Instant timestamp,
        String source,
        String fetchKey,
        boolean fromCache,
        int recordCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FetchCompleted";
    }
}

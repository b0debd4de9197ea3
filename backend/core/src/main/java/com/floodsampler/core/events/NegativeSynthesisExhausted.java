package com.floodsampler.core.events;

import java.time.Instant;

public record NegativeSynthesisExhausted(
        Instant timestamp,
        String positiveProvenance,
        int slot,
        int attempts
) implements Event {
    @Override
    public String type() {
        return "NegativeSynthesisExhausted";
    }
}

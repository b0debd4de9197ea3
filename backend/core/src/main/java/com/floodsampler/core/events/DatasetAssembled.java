package com.floodsampler.core.events;

import java.time.Instant;

public record DatasetAssembled(
        Instant timestamp,
        String regionId,
        int positives,
        int negatives,
        int targetNegatives,
        double achievedRatio
) implements Event {
    @Override
    public String type() {
        return "DatasetAssembled";
    }
}

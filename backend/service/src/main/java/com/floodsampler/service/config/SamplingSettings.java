package com.floodsampler.service.config;

import com.floodsampler.core.sampling.NegativeSamplingConfig;

import java.time.Duration;

public record SamplingSettings(
        Double ratio,
        Double exclusionRadiusKm,
        Duration exclusionWindow,
        Double maxDisplacementKm,
        Duration maxTimeShift,
        Integer maxAttempts,
        Long seedBasis,
        Double dedupCellDegrees
) {
    public static SamplingSettings defaults() {
        return new SamplingSettings(null, null, null, null, null, null, null, null);
    }

    public SamplingSettings withRatio(Double newRatio) {
        return new SamplingSettings(newRatio, exclusionRadiusKm, exclusionWindow, maxDisplacementKm,
                maxTimeShift, maxAttempts, seedBasis, dedupCellDegrees);
    }

    public SamplingSettings withSeedBasis(Long newSeedBasis) {
        return new SamplingSettings(ratio, exclusionRadiusKm, exclusionWindow, maxDisplacementKm,
                maxTimeShift, maxAttempts, newSeedBasis, dedupCellDegrees);
    }

    public NegativeSamplingConfig toConfig() {
        return new NegativeSamplingConfig(
                orDefault(ratio, NegativeSamplingConfig.DEFAULT_RATIO),
                orDefault(exclusionRadiusKm, NegativeSamplingConfig.DEFAULT_EXCLUSION_RADIUS_KM),
                exclusionWindow == null ? NegativeSamplingConfig.DEFAULT_EXCLUSION_WINDOW : exclusionWindow,
                orDefault(maxDisplacementKm, NegativeSamplingConfig.DEFAULT_MAX_DISPLACEMENT_KM),
                maxTimeShift == null ? NegativeSamplingConfig.DEFAULT_MAX_TIME_SHIFT : maxTimeShift,
                maxAttempts == null ? NegativeSamplingConfig.DEFAULT_MAX_ATTEMPTS : maxAttempts,
                seedBasis == null ? 0L : seedBasis,
                orDefault(dedupCellDegrees, NegativeSamplingConfig.DEFAULT_DEDUP_CELL_DEGREES)
        );
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}

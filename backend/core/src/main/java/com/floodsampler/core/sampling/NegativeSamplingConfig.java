package com.floodsampler.core.sampling;

import java.time.Duration;

public record NegativeSamplingConfig(
        double ratio,
        double exclusionRadiusKm,
        Duration exclusionWindow,
        double maxDisplacementKm,
        Duration maxTimeShift,
        int maxAttempts,
        long seedBasis,
        double dedupCellDegrees
) {
    public static final double DEFAULT_RATIO = 1.0;
    public static final double DEFAULT_EXCLUSION_RADIUS_KM = 25.0;
    public static final Duration DEFAULT_EXCLUSION_WINDOW = Duration.ofHours(48);
    public static final double DEFAULT_MAX_DISPLACEMENT_KM = 55.0;
    public static final Duration DEFAULT_MAX_TIME_SHIFT = Duration.ofDays(28);
    public static final int DEFAULT_MAX_ATTEMPTS = 12;
    public static final double DEFAULT_DEDUP_CELL_DEGREES = 0.01;

    public NegativeSamplingConfig {
        if (Double.isNaN(ratio) || ratio < 0.0) {
            throw new IllegalArgumentException("ratio must be >= 0, got: " + ratio);
        }
        if (exclusionRadiusKm <= 0.0) {
            throw new IllegalArgumentException("exclusionRadiusKm must be positive, got: " + exclusionRadiusKm);
        }
        if (exclusionWindow == null || exclusionWindow.isNegative() || exclusionWindow.isZero()) {
            throw new IllegalArgumentException("exclusionWindow must be positive, got: " + exclusionWindow);
        }
        if (maxDisplacementKm <= exclusionRadiusKm) {
            throw new IllegalArgumentException("maxDisplacementKm (" + maxDisplacementKm
                    + ") must exceed exclusionRadiusKm (" + exclusionRadiusKm + ")");
        }
        if (maxTimeShift == null || maxTimeShift.getSeconds() <= exclusionWindow.getSeconds()) {
            throw new IllegalArgumentException("maxTimeShift (" + maxTimeShift
                    + ") must exceed exclusionWindow (" + exclusionWindow + ") by at least one second");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (dedupCellDegrees <= 0.0) {
            throw new IllegalArgumentException("dedupCellDegrees must be positive, got: " + dedupCellDegrees);
        }
    }

    public static NegativeSamplingConfig defaults() {
        return new NegativeSamplingConfig(
                DEFAULT_RATIO,
                DEFAULT_EXCLUSION_RADIUS_KM,
                DEFAULT_EXCLUSION_WINDOW,
                DEFAULT_MAX_DISPLACEMENT_KM,
                DEFAULT_MAX_TIME_SHIFT,
                DEFAULT_MAX_ATTEMPTS,
                0L,
                DEFAULT_DEDUP_CELL_DEGREES
        );
    }

    public NegativeSamplingConfig withRatio(double newRatio) {
        return new NegativeSamplingConfig(newRatio, exclusionRadiusKm, exclusionWindow, maxDisplacementKm,
                maxTimeShift, maxAttempts, seedBasis, dedupCellDegrees);
    }

    public NegativeSamplingConfig withExclusion(double radiusKm, Duration window) {
        return new NegativeSamplingConfig(ratio, radiusKm, window, maxDisplacementKm,
                maxTimeShift, maxAttempts, seedBasis, dedupCellDegrees);
    }

    public NegativeSamplingConfig withSeedBasis(long newSeedBasis) {
        return new NegativeSamplingConfig(ratio, exclusionRadiusKm, exclusionWindow, maxDisplacementKm,
                maxTimeShift, maxAttempts, newSeedBasis, dedupCellDegrees);
    }

    public int targetFor(int positives) {
        if (positives == 0 || ratio == 0.0) {
            return 0;
        }
        return (int) Math.ceil(ratio * positives - 1e-9);
    }
}

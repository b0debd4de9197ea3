package com.floodsampler.core.sampling;

import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.util.GeoUtils;
import com.floodsampler.core.util.HashingUtils;

import java.time.Instant;
import java.util.SplittableRandom;

final class CandidatePerturbation {
    private final long seedBasis;
    private final double minDistanceKm;
    private final double maxDistanceKm;
    private final long minShiftSeconds;
    private final long maxShiftSeconds;

    CandidatePerturbation(NegativeSamplingConfig config) {
        this.seedBasis = config.seedBasis();
        this.minDistanceKm = config.exclusionRadiusKm();
        this.maxDistanceKm = config.maxDisplacementKm();
        this.minShiftSeconds = config.exclusionWindow().getSeconds() + 1;
        this.maxShiftSeconds = config.maxTimeShift().getSeconds();
    }

    Candidate draw(Sample origin, int slot, int attempt) {
        SplittableRandom random = new SplittableRandom(HashingUtils.seed(seedBasis, origin.identity(), slot, attempt));

        double bearing = random.nextDouble() * 2.0 * Math.PI;
        // 1 - nextDouble() lies in (0, 1], so the distance lies in (min, max]
        double distanceKm = minDistanceKm + (1.0 - random.nextDouble()) * (maxDistanceKm - minDistanceKm);
        GeoPoint location = GeoUtils.destination(origin.location(), bearing, distanceKm);

        long magnitude = minShiftSeconds + random.nextLong(maxShiftSeconds - minShiftSeconds + 1);
        long shift = random.nextBoolean() ? magnitude : -magnitude;
        Instant timestamp = origin.timestamp().plusSeconds(shift);

        return new Candidate(location, timestamp);
    }

    record Candidate(GeoPoint location, Instant timestamp) {
    }
}

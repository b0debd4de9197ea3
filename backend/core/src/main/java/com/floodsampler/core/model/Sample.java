package com.floodsampler.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Objects;

public record Sample(GeoPoint location, Instant timestamp, SampleLabel label, String provenance) {
    public static final Comparator<Sample> CANONICAL_ORDER = Comparator
            .comparing(Sample::timestamp)
            .thenComparing(Sample::location)
            .thenComparing(Sample::label)
            .thenComparing(Sample::provenance);

    public Sample {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(provenance, "provenance is required");
    }

    public static Sample positive(GeoPoint location, Instant timestamp, String provenance) {
        return new Sample(location, timestamp, SampleLabel.POSITIVE, provenance);
    }

    public static Sample negative(GeoPoint location, Instant timestamp, String provenance) {
        return new Sample(location, timestamp, SampleLabel.NEGATIVE, provenance);
    }

    public String identity() {
        return label.name() + "|" + location.lat() + "|" + location.lon() + "|" + timestamp + "|" + provenance;
    }

    public DiscreteKey discreteKey() {
        return new DiscreteKey(
                Math.round(location.lat() * 10_000.0),
                Math.round(location.lon() * 10_000.0),
                timestamp.truncatedTo(ChronoUnit.SECONDS)
        );
    }

    public record DiscreteKey(long latE4, long lonE4, Instant second) {
    }
}

package com.floodsampler.core.model;

import java.time.Instant;

public record GaugeReading(Instant observedAt, double stageFt) {
}

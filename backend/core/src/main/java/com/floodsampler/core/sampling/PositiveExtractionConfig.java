package com.floodsampler.core.sampling;

import com.floodsampler.core.model.AlertSeverity;

import java.time.Duration;

public record PositiveExtractionConfig(
        AlertSeverity minimumSeverity,
        GaugeCorroboration corroboration,
        double stationSearchRadiusKm,
        Duration gaugeSlack
) {
    public static final double DEFAULT_STATION_SEARCH_RADIUS_KM = 25.0;
    public static final Duration DEFAULT_GAUGE_SLACK = Duration.ofHours(24);

    public PositiveExtractionConfig {
        minimumSeverity = minimumSeverity == null ? AlertSeverity.ADVISORY : minimumSeverity;
        corroboration = corroboration == null ? GaugeCorroboration.LENIENT : corroboration;
        gaugeSlack = gaugeSlack == null ? DEFAULT_GAUGE_SLACK : gaugeSlack;
        if (stationSearchRadiusKm <= 0.0) {
            throw new IllegalArgumentException("stationSearchRadiusKm must be positive, got: " + stationSearchRadiusKm);
        }
        if (gaugeSlack.isNegative()) {
            throw new IllegalArgumentException("gaugeSlack must not be negative, got: " + gaugeSlack);
        }
    }

    public static PositiveExtractionConfig defaults() {
        return new PositiveExtractionConfig(null, null, DEFAULT_STATION_SEARCH_RADIUS_KM, null);
    }
}

package com.floodsampler.service.config;

import com.floodsampler.core.model.AlertSeverity;
import com.floodsampler.core.sampling.GaugeCorroboration;
import com.floodsampler.core.sampling.PositiveExtractionConfig;

import java.time.Duration;

public record ExtractionSettings(
        AlertSeverity minimumSeverity,
        GaugeCorroboration corroboration,
        Double stationSearchRadiusKm,
        Duration gaugeSlack
) {
    public static ExtractionSettings defaults() {
        return new ExtractionSettings(null, null, null, null);
    }

    public PositiveExtractionConfig toConfig() {
        return new PositiveExtractionConfig(
                minimumSeverity,
                corroboration,
                stationSearchRadiusKm == null ? PositiveExtractionConfig.DEFAULT_STATION_SEARCH_RADIUS_KM : stationSearchRadiusKm,
                gaugeSlack
        );
    }
}

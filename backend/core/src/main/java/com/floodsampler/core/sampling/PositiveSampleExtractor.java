package com.floodsampler.core.sampling;

import com.floodsampler.core.model.AlertRecord;
import com.floodsampler.core.model.GaugeReading;
import com.floodsampler.core.model.GaugeRecord;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.util.GeoUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

public final class PositiveSampleExtractor {
    private static final Logger LOGGER = Logger.getLogger(PositiveSampleExtractor.class.getName());

    private final PositiveExtractionConfig config;

    public PositiveSampleExtractor(PositiveExtractionConfig config) {
        this.config = config;
    }

    public List<Sample> extract(List<AlertRecord> alerts, List<GaugeRecord> gauges) {
        List<GaugeRecord> staged = gauges.stream()
                .filter(GaugeRecord::hasFloodStage)
                .sorted(Comparator.comparing(GaugeRecord::stationId))
                .toList();

        List<Sample> positives = new ArrayList<>();
        int belowThreshold = 0;
        int uncorroborated = 0;
        for (AlertRecord alert : alerts) {
            if (!alert.severity().atLeast(config.minimumSeverity())) {
                belowThreshold++;
                continue;
            }
            GeoPoint point = alert.representativePoint();
            GaugeEvidence evidence = config.corroboration() == GaugeCorroboration.OFF
                    ? GaugeEvidence.NONE
                    : evidenceFor(alert, point, staged);
            if (!accepts(evidence)) {
                uncorroborated++;
                LOGGER.fine(() -> "Discarding alert " + alert.id() + ": gauges did not reach flood stage");
                continue;
            }
            String provenance = "alert:" + alert.id();
            if (evidence.stationId() != null) {
                provenance += ";gauge:" + evidence.stationId();
            }
            positives.add(Sample.positive(point, alert.onset(), provenance));
        }
        positives.sort(Sample.CANONICAL_ORDER);

        int skippedSeverity = belowThreshold;
        int skippedGauge = uncorroborated;
        LOGGER.fine(() -> "Extracted " + positives.size() + " positives from " + alerts.size() + " alerts ("
                + skippedSeverity + " below threshold, " + skippedGauge + " not corroborated)");
        return List.copyOf(positives);
    }

    private boolean accepts(GaugeEvidence evidence) {
        return switch (config.corroboration()) {
            case OFF -> true;
            case LENIENT -> evidence.readings() == 0 || evidence.stationId() != null;
            case STRICT -> evidence.stationId() != null;
        };
    }

    private GaugeEvidence evidenceFor(AlertRecord alert, GeoPoint point, List<GaugeRecord> staged) {
        double searchRadiusKm = Math.max(config.stationSearchRadiusKm(), alert.extentRadiusKm());
        Instant from = alert.onset().minus(config.gaugeSlack());
        Instant to = alert.expires().plus(config.gaugeSlack());

        int readings = 0;
        for (GaugeRecord gauge : staged) {
            if (GeoUtils.haversineKm(point, gauge.location()) > searchRadiusKm) {
                continue;
            }
            List<GaugeReading> relevant = gauge.readingsBetween(from, to);
            readings += relevant.size();
            for (GaugeReading reading : relevant) {
                if (reading.stageFt() >= gauge.floodStageFt()) {
                    return new GaugeEvidence(readings, gauge.stationId());
                }
            }
        }
        return new GaugeEvidence(readings, null);
    }

    private record GaugeEvidence(int readings, String stationId) {
        static final GaugeEvidence NONE = new GaugeEvidence(0, null);
    }
}

package com.floodsampler.service.runtime;

import com.floodsampler.core.bus.EventBus;
import com.floodsampler.core.events.DatasetAssembled;
import com.floodsampler.core.events.Event;
import com.floodsampler.core.events.FetchCompleted;
import com.floodsampler.core.events.FetchFailed;
import com.floodsampler.core.model.FetchKey;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.RegionFilter;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.model.SampleLabel;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.core.model.TimeWindow;
import com.floodsampler.core.sampling.DatasetAssembler;
import com.floodsampler.core.sampling.NegativeSampleGenerator;
import com.floodsampler.core.sampling.NegativeSamplingConfig;
import com.floodsampler.core.sampling.PositiveExtractionConfig;
import com.floodsampler.core.sampling.PositiveSampleExtractor;
import com.floodsampler.core.util.GeoUtils;
import com.floodsampler.service.region.RegionCatalog;
import com.floodsampler.service.store.FileCacheStore;
import com.floodsampler.service.support.FakeSources;
import com.floodsampler.sources.api.CacheConsistencyException;
import com.floodsampler.sources.api.CacheStore;
import com.floodsampler.sources.cache.CachingAlertSource;
import com.floodsampler.sources.cache.CachingGaugeSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetBuildServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC);
    private static final GeoPoint AUSTIN = new GeoPoint(30.2672, -97.7431);
    private static final TimeInterval Q1_2024 = new TimeInterval(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"));
    private static final TimeInterval Q1_2025 = new TimeInterval(
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z"));
    private static final TimeWindow WINDOW = TimeWindow.of(Q1_2024, Q1_2025);

    @TempDir
    Path tempDir;

    private final Region travis = RegionCatalog.loadDefault().resolve(new RegionFilter("Travis", "Texas"));

    @Test
    void rerunIsServedEntirelyFromCache() {
        FakeSources.Alerts alerts = new FakeSources.Alerts(AUSTIN, 3);
        FakeSources.Gauges gauges = new FakeSources.Gauges();
        FileCacheStore cache = new FileCacheStore(tempDir.resolve("cache"));

        BuildReport first = service(alerts, gauges, cache, new EventBus()).build(travis, WINDOW);
        BuildReport second = service(alerts, gauges, new FileCacheStore(tempDir.resolve("cache")), new EventBus())
                .build(travis, WINDOW);

        assertEquals(4, first.upstreamFetches());
        assertEquals(0, first.cacheHits());
        assertEquals(0, second.upstreamFetches());
        assertEquals(4, second.cacheHits());
        assertEquals(2, alerts.calls());
        assertEquals(2, gauges.calls());
        assertEquals(first.samples(), second.samples());
        assertEquals(6, first.positives());
    }

    @Test
    void reportsCountsAndPublishesEvents() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        List<Event> events = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.class, events::add);

        BuildReport report = service(new FakeSources.Alerts(AUSTIN, 4), new FakeSources.Gauges(),
                new FileCacheStore(tempDir), bus).build(travis, WINDOW);

        assertEquals("US-TX-travis", report.regionId());
        assertEquals(8, report.positives());
        assertEquals(8, report.targetNegatives());
        assertEquals(report.positives() + report.negatives(), report.samples().size());
        assertTrue(report.droppedCandidates() <= report.targetNegatives());
        assertTrue(report.negatives() <= report.targetNegatives());
        assertTrue(report.failedFetches().isEmpty());
        assertEquals(4, events.stream().filter(FetchCompleted.class::isInstance).count());
        DatasetAssembled assembled = events.stream()
                .filter(DatasetAssembled.class::isInstance)
                .map(DatasetAssembled.class::cast)
                .findFirst()
                .orElseThrow();
        assertEquals(report.negatives(), assembled.negatives());
        assertEquals(report.achievedRatio(), assembled.achievedRatio());
        assertTrue(report.summary().contains("positives=8"));
    }

    @Test
    void failedFetchUnitDoesNotAbortRun() {
        FakeSources.Gauges gauges = new FakeSources.Gauges();
        gauges.failFor(Q1_2024);
        EventBus bus = new EventBus();
        List<FetchFailed> failures = new CopyOnWriteArrayList<>();
        bus.subscribe(FetchFailed.class, failures::add);

        BuildReport report = service(new FakeSources.Alerts(AUSTIN, 2), gauges, new FileCacheStore(tempDir), bus)
                .build(travis, WINDOW);

        assertEquals(4, report.positives());
        assertEquals(1, report.failedFetches().size());
        BuildReport.FailedFetch failed = report.failedFetches().get(0);
        assertEquals("fake-gauges", failed.source());
        assertTrue(failed.retryable());
        assertEquals(2, failed.attempts());
        assertEquals(1, failures.size());
        assertEquals(3, report.upstreamFetches());
        assertEquals(3, gauges.calls());
    }

    @Test
    void conflictingPayloadForSameKeyAbortsRun() {
        FakeSources.Alerts alerts = new FakeSources.Alerts(AUSTIN, 2);
        FileCacheStore files = new FileCacheStore(tempDir);
        service(alerts, new FakeSources.Gauges(), files, new EventBus()).build(travis, WINDOW);

        alerts.revise("-r2");
        CacheStore writeOnly = new CacheStore() {
            @Override
            public Optional<String> get(FetchKey key) {
                return Optional.empty();
            }

            @Override
            public void put(FetchKey key, String payload) {
                files.put(key, payload);
            }
        };

        assertThrows(CacheConsistencyException.class, () ->
                service(alerts, new FakeSources.Gauges(), writeOnly, new EventBus()).build(travis, WINDOW));
    }

    @Test
    void floodStagesFromConfigApplyToCachedGaugeRecords() {
        FakeSources.Alerts alerts = new FakeSources.Alerts(AUSTIN, 3);
        FakeSources.Gauges gauges = new FakeSources.Gauges(AUSTIN, 25.0);
        FileCacheStore cache = new FileCacheStore(tempDir.resolve("cache"));

        BuildReport belowReading = service(alerts, gauges, cache, new EventBus(),
                Map.of(FakeSources.Gauges.STATION_ID, 21.0)).build(travis, WINDOW);
        BuildReport aboveReading = service(alerts, gauges, cache, new EventBus(),
                Map.of(FakeSources.Gauges.STATION_ID, 30.0)).build(travis, WINDOW);

        assertEquals(6, belowReading.positives());
        assertTrue(belowReading.samples().stream()
                .filter(sample -> sample.label() == SampleLabel.POSITIVE)
                .allMatch(sample -> sample.provenance().endsWith(";gauge:" + FakeSources.Gauges.STATION_ID)));
        assertEquals(4, aboveReading.cacheHits());
        assertEquals(2, gauges.calls());
        assertEquals(0, aboveReading.positives());
        assertFalse(cache.get(FetchKey.of("fake-gauges", travis, Q1_2024)).orElseThrow().contains("floodStageFt"));
    }

    @Test
    void datasetHonoursExclusionZones() {
        BuildReport report = service(new FakeSources.Alerts(AUSTIN, 5), new FakeSources.Gauges(),
                new FileCacheStore(tempDir), new EventBus()).build(travis, WINDOW);
        NegativeSamplingConfig config = NegativeSamplingConfig.defaults();

        List<Sample> positives = report.samples().stream().filter(s -> s.label() == SampleLabel.POSITIVE).toList();
        List<Sample> negatives = report.samples().stream().filter(s -> s.label() == SampleLabel.NEGATIVE).toList();
        for (Sample negative : negatives) {
            for (Sample positive : positives) {
                boolean near = GeoUtils.haversineKm(positive.location(), negative.location())
                        <= config.exclusionRadiusKm();
                boolean close = Duration.between(positive.timestamp(), negative.timestamp()).abs()
                        .compareTo(config.exclusionWindow()) <= 0;
                assertFalse(near && close);
            }
        }
    }

    private DatasetBuildService service(
            FakeSources.Alerts alerts,
            FakeSources.Gauges gauges,
            CacheStore cache,
            EventBus bus
    ) {
        return service(alerts, gauges, cache, bus, Map.of());
    }

    private DatasetBuildService service(
            FakeSources.Alerts alerts,
            FakeSources.Gauges gauges,
            CacheStore cache,
            EventBus bus,
            Map<String, Double> floodStagesFt
    ) {
        return new DatasetBuildService(
                new CachingAlertSource(alerts, cache),
                new CachingGaugeSource(gauges, cache),
                new PositiveSampleExtractor(PositiveExtractionConfig.defaults()),
                new NegativeSampleGenerator(NegativeSamplingConfig.defaults()),
                new DatasetAssembler(),
                floodStagesFt,
                bus,
                CLOCK,
                new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO),
                3
        );
    }
}

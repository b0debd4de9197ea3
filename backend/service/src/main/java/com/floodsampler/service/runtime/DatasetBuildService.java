package com.floodsampler.service.runtime;

import com.floodsampler.core.bus.EventBus;
import com.floodsampler.core.events.DatasetAssembled;
import com.floodsampler.core.events.FetchCompleted;
import com.floodsampler.core.events.FetchFailed;
import com.floodsampler.core.events.NegativeSynthesisExhausted;
import com.floodsampler.core.model.AlertRecord;
import com.floodsampler.core.model.FetchKey;
import com.floodsampler.core.model.GaugeReading;
import com.floodsampler.core.model.GaugeRecord;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.model.SampleLabel;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.core.model.TimeWindow;
import com.floodsampler.core.sampling.DatasetAssembler;
import com.floodsampler.core.sampling.NegativeSampleGenerator;
import com.floodsampler.core.sampling.NegativeSynthesisResult;
import com.floodsampler.core.sampling.PositiveSampleExtractor;
import com.floodsampler.sources.api.SourceException;
import com.floodsampler.sources.cache.CachingAlertSource;
import com.floodsampler.sources.cache.CachingGaugeSource;
import com.floodsampler.sources.cache.CachingRecordSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DatasetBuildService {
    private static final Logger LOGGER = Logger.getLogger(DatasetBuildService.class.getName());

    private final CachingAlertSource alertSource;
    private final CachingGaugeSource gaugeSource;
    private final PositiveSampleExtractor extractor;
    private final NegativeSampleGenerator generator;
    private final DatasetAssembler assembler;
    private final Map<String, Double> floodStagesFt;
    private final EventBus eventBus;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final int workers;

    public DatasetBuildService(
            CachingAlertSource alertSource,
            CachingGaugeSource gaugeSource,
            PositiveSampleExtractor extractor,
            NegativeSampleGenerator generator,
            DatasetAssembler assembler,
            Map<String, Double> floodStagesFt,
            EventBus eventBus,
            Clock clock,
            RetryPolicy retryPolicy,
            int workers
    ) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + workers);
        }
        this.alertSource = alertSource;
        this.gaugeSource = gaugeSource;
        this.extractor = extractor;
        this.generator = generator;
        this.assembler = assembler;
        this.floodStagesFt = floodStagesFt == null ? Map.of() : Map.copyOf(floodStagesFt);
        this.eventBus = eventBus;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
    }

    public BuildReport build(Region region, TimeWindow window) {
        LOGGER.info("Building dataset for " + region.name() + " over " + window.intervals().size() + " sub-interval(s)");

        List<UnitOutcome<AlertRecord>> alertUnits;
        List<UnitOutcome<GaugeRecord>> gaugeUnits;
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            List<CompletableFuture<UnitOutcome<AlertRecord>>> alertTasks = new ArrayList<>();
            List<CompletableFuture<UnitOutcome<GaugeRecord>>> gaugeTasks = new ArrayList<>();
            for (TimeInterval interval : window.intervals()) {
                alertTasks.add(CompletableFuture.supplyAsync(() -> runUnit(alertSource, region, interval), pool));
                gaugeTasks.add(CompletableFuture.supplyAsync(() -> runUnit(gaugeSource, region, interval), pool));
            }
            alertUnits = joinAll(alertTasks);
            gaugeUnits = joinAll(gaugeTasks);
        } finally {
            pool.shutdownNow();
        }

        List<AlertRecord> alerts = mergeAlerts(alertUnits);
        List<GaugeRecord> gauges = mergeGauges(gaugeUnits);
        LOGGER.info("Fetched " + alerts.size() + " alerts and " + gauges.size() + " gauge stations");

        List<Sample> positives = extractor.extract(alerts, gauges);
        NegativeSynthesisResult synthesis = generator.synthesize(positives, region, window);
        for (NegativeSynthesisResult.Exhausted dropped : synthesis.exhausted()) {
            eventBus.publish(new NegativeSynthesisExhausted(
                    clock.instant(), dropped.positiveProvenance(), dropped.slot(), dropped.attempts()));
        }
        List<Sample> samples = assembler.assemble(positives, synthesis.negatives());

        int positiveCount = (int) samples.stream().filter(sample -> sample.label() == SampleLabel.POSITIVE).count();
        int negativeCount = samples.size() - positiveCount;
        List<BuildReport.FailedFetch> failures = new ArrayList<>();
        int upstream = 0;
        int hits = 0;
        for (UnitOutcome<?> unit : concat(alertUnits, gaugeUnits)) {
            if (unit.failure() != null) {
                failures.add(unit.failure());
            } else if (unit.fromCache()) {
                hits++;
            } else {
                upstream++;
            }
        }

        BuildReport report = new BuildReport(
                region.id(),
                samples,
                positiveCount,
                negativeCount,
                synthesis.target(),
                synthesis.exhausted().size(),
                failures,
                upstream,
                hits
        );
        eventBus.publish(new DatasetAssembled(
                clock.instant(), region.id(), positiveCount, negativeCount, synthesis.target(), report.achievedRatio()));
        if (report.underSampled()) {
            LOGGER.warning("Negatives below target (" + negativeCount + " of " + synthesis.target() + ")");
        }
        LOGGER.info("Dataset assembled: " + report.summary());
        return report;
    }

    private <T> UnitOutcome<T> runUnit(CachingRecordSource<T> source, Region region, TimeInterval interval) {
        FetchKey key = FetchKey.of(source.name(), region, interval);
        Instant started = clock.instant();
        try {
            RetryPolicy.Attempted<CachingRecordSource.Fetched<T>> attempted = retryPolicy.call(
                    () -> source.fetchTracked(region, interval),
                    (attempt, error, backoff) -> LOGGER.warning("Retrying " + key.canonical() + " after attempt "
                            + attempt + " in " + backoff.toMillis() + "ms: " + error.getMessage())
            );
            CachingRecordSource.Fetched<T> fetched = attempted.value();
            eventBus.publish(new FetchCompleted(
                    clock.instant(),
                    source.name(),
                    key.canonical(),
                    fetched.fromCache(),
                    fetched.records().size(),
                    Duration.between(started, clock.instant()).toMillis()
            ));
            return new UnitOutcome<>(fetched.records(), fetched.fromCache(), null);
        } catch (RetryPolicy.RetriesExhaustedException e) {
            SourceException cause = e.lastFailure();
            LOGGER.log(Level.WARNING, "Fetch unit " + key.canonical() + " failed after " + e.attempts() + " attempt(s)", cause);
            eventBus.publish(new FetchFailed(
                    clock.instant(), source.name(), key.canonical(), cause.retryable(), e.attempts(), cause.getMessage()));
            return new UnitOutcome<>(List.of(), false, new BuildReport.FailedFetch(
                    source.name(), key.canonical(), cause.retryable(), e.attempts(), cause.getMessage()));
        }
    }

    private static <T> List<UnitOutcome<T>> joinAll(List<CompletableFuture<UnitOutcome<T>>> tasks) {
        List<UnitOutcome<T>> outcomes = new ArrayList<>();
        try {
            for (CompletableFuture<UnitOutcome<T>> task : tasks) {
                outcomes.add(task.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tasks.forEach(task -> task.cancel(true));
            throw new IllegalStateException("Dataset build interrupted during fetch", e);
        } catch (ExecutionException e) {
            tasks.forEach(task -> task.cancel(true));
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Fetch unit failed", cause);
        }
        return outcomes;
    }

    private static List<AlertRecord> mergeAlerts(List<UnitOutcome<AlertRecord>> units) {
        Map<String, AlertRecord> byId = new LinkedHashMap<>();
        for (UnitOutcome<AlertRecord> unit : units) {
            unit.records().forEach(alert -> byId.putIfAbsent(alert.id(), alert));
        }
        List<AlertRecord> alerts = new ArrayList<>(byId.values());
        alerts.sort(Comparator.comparing(AlertRecord::onset).thenComparing(AlertRecord::id));
        return alerts;
    }

    // cache entries hold upstream data only; flood stages are joined here
    private List<GaugeRecord> mergeGauges(List<UnitOutcome<GaugeRecord>> units) {
        Map<String, GaugeRecord> stations = new TreeMap<>();
        Map<String, List<GaugeReading>> readings = new TreeMap<>();
        for (UnitOutcome<GaugeRecord> unit : units) {
            for (GaugeRecord gauge : unit.records()) {
                stations.putIfAbsent(gauge.stationId(), gauge);
                readings.computeIfAbsent(gauge.stationId(), ignored -> new ArrayList<>()).addAll(gauge.readings());
            }
        }
        List<GaugeRecord> merged = new ArrayList<>();
        stations.forEach((id, gauge) -> merged.add(new GaugeRecord(
                id,
                gauge.name(),
                gauge.location(),
                floodStagesFt.get(id),
                readings.get(id).stream()
                        .distinct()
                        .sorted(Comparator.comparing(GaugeReading::observedAt).thenComparingDouble(GaugeReading::stageFt))
                        .toList()
        )));
        return merged;
    }

    private static List<UnitOutcome<?>> concat(List<? extends UnitOutcome<?>> first, List<? extends UnitOutcome<?>> second) {
        List<UnitOutcome<?>> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fetch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record UnitOutcome<T>(List<T> records, boolean fromCache, BuildReport.FailedFetch failure) {
    }
}

package com.floodsampler.service;

import com.floodsampler.core.bus.EventBus;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeWindow;
import com.floodsampler.core.sampling.DatasetAssembler;
import com.floodsampler.core.sampling.NegativeSampleGenerator;
import com.floodsampler.core.sampling.PositiveSampleExtractor;
import com.floodsampler.service.config.BuildConfig;
import com.floodsampler.service.config.ConfigLoader;
import com.floodsampler.service.config.SourceSettings;
import com.floodsampler.service.http.HttpClientFactory;
import com.floodsampler.service.output.CsvDatasetWriter;
import com.floodsampler.service.region.CatalogAreaLocator;
import com.floodsampler.service.region.RegionCatalog;
import com.floodsampler.service.runtime.BuildReport;
import com.floodsampler.service.runtime.DatasetBuildService;
import com.floodsampler.service.store.FileCacheStore;
import com.floodsampler.sources.cache.CachingAlertSource;
import com.floodsampler.sources.cache.CachingGaugeSource;
import com.floodsampler.sources.http.UpstreamHttp;
import com.floodsampler.sources.iem.IemAlertSource;
import com.floodsampler.sources.usgs.UsgsGaugeSource;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private Main() {
    }

    public static void main(String[] args) {
        int code = run(args, System.getenv(), Clock.systemUTC(), System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Map<String, String> environment, Clock clock, PrintStream out, PrintStream err) {
        return run(args, environment, clock, out, err, RegionCatalog::loadDefault);
    }

    static int run(
            String[] args,
            Map<String, String> environment,
            Clock clock,
            PrintStream out,
            PrintStream err,
            Supplier<RegionCatalog> catalogLoader
    ) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CommandLineOptions.usage());
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.println(CommandLineOptions.usage());
            return EXIT_OK;
        }

        try {
            RegionCatalog catalog = catalogLoader.get();
            Region region;
            try {
                region = catalog.resolve(options.regionFilter());
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }

            BuildConfig config = applyOptions(ConfigLoader.load(options.configFile(), environment), options);
            TimeWindow window = TimeWindow.lastYears(options.years(), options.months(), clock);
            HttpClient httpClient = HttpClientFactory.create(config.http(), environment);

            DatasetBuildService service = createService(config, catalog, httpClient, clock);
            BuildReport report = service.build(region, window);
            new CsvDatasetWriter().write(Path.of(config.outputFile()), report.samples());

            printReport(out, report, config.outputFile());
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Dataset build failed", e);
            err.println("Dataset build failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static DatasetBuildService createService(BuildConfig config, RegionCatalog catalog, HttpClient httpClient, Clock clock) {
        SourceSettings sources = config.sources();
        UpstreamHttp http = new UpstreamHttp(httpClient, config.http().requestTimeout(), config.userAgent());
        FileCacheStore cacheStore = new FileCacheStore(Path.of(config.cacheDir()));

        CachingAlertSource alertSource = new CachingAlertSource(
                new IemAlertSource(http, new CatalogAreaLocator(catalog), sources.iemBaseUrl()),
                cacheStore
        );
        CachingGaugeSource gaugeSource = new CachingGaugeSource(
                new UsgsGaugeSource(
                        http,
                        sources.usgsBaseUrl(),
                        sources.usgsApiKey(),
                        sources.usgsPageSize(),
                        sources.usgsMaxPages()
                ),
                cacheStore
        );

        return new DatasetBuildService(
                alertSource,
                gaugeSource,
                new PositiveSampleExtractor(config.extraction().toConfig()),
                new NegativeSampleGenerator(config.sampling().toConfig()),
                new DatasetAssembler(),
                sources.floodStagesFt(),
                new EventBus(),
                clock,
                config.retry().toPolicy(),
                config.workers()
        );
    }

    static BuildConfig applyOptions(BuildConfig config, CommandLineOptions options) {
        BuildConfig result = config;
        if (options.outputFile() != null) {
            result = result.withOutputFile(options.outputFile().toString());
        }
        if (options.cacheDir() != null) {
            result = result.withCacheDir(options.cacheDir().toString());
        }
        if (options.ratio() != null) {
            result = result.withSampling(result.sampling().withRatio(options.ratio()));
        }
        if (options.seed() != null) {
            result = result.withSampling(result.sampling().withSeedBasis(options.seed()));
        }
        return result;
    }

    private static void printReport(PrintStream out, BuildReport report, String outputFile) {
        out.println("Region: " + report.regionId());
        out.println("Flood samples (label 1): " + report.positives());
        out.println("Non-flood samples (label 0): " + report.negatives() + " of " + report.targetNegatives() + " targeted");
        out.println(String.format(Locale.ROOT, "Achieved ratio: %.3f", report.achievedRatio()));
        if (report.droppedCandidates() > 0) {
            out.println("Dropped negative slots: " + report.droppedCandidates());
        }
        for (BuildReport.FailedFetch failure : report.failedFetches()) {
            out.println("Failed fetch: " + failure.fetchKey() + " after " + failure.attempts() + " attempt(s): "
                    + failure.message());
        }
        out.println("Upstream fetches: " + report.upstreamFetches() + ", cache hits: " + report.cacheHits());
        out.println("Wrote " + report.samples().size() + " samples to " + outputFile);
    }
}

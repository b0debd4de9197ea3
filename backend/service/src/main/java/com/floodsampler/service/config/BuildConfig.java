package com.floodsampler.service.config;

public record BuildConfig(
        String cacheDir,
        String outputFile,
        Integer workers,
        String userAgent,
        HttpSettings http,
        RetrySettings retry,
        SourceSettings sources,
        ExtractionSettings extraction,
        SamplingSettings sampling
) {
    public static final String DEFAULT_USER_AGENT = "flood-sampler/0.1 (contact: data@example.com)";

    public BuildConfig {
        cacheDir = cacheDir == null ? "raw_data/cache" : cacheDir;
        outputFile = outputFile == null ? "raw_data/flood_dataset.csv" : outputFile;
        workers = workers == null ? 4 : workers;
        userAgent = userAgent == null ? DEFAULT_USER_AGENT : userAgent;
        http = http == null ? HttpSettings.defaults() : http;
        retry = retry == null ? RetrySettings.defaults() : retry;
        sources = sources == null ? SourceSettings.defaults() : sources;
        extraction = extraction == null ? ExtractionSettings.defaults() : extraction;
        sampling = sampling == null ? SamplingSettings.defaults() : sampling;
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + workers);
        }
    }

    public static BuildConfig defaults() {
        return new BuildConfig(null, null, null, null, null, null, null, null, null);
    }

    public BuildConfig withCacheDir(String dir) {
        return new BuildConfig(dir, outputFile, workers, userAgent, http, retry, sources, extraction, sampling);
    }

    public BuildConfig withOutputFile(String file) {
        return new BuildConfig(cacheDir, file, workers, userAgent, http, retry, sources, extraction, sampling);
    }

    public BuildConfig withUserAgent(String agent) {
        return new BuildConfig(cacheDir, outputFile, workers, agent, http, retry, sources, extraction, sampling);
    }

    public BuildConfig withSources(SourceSettings newSources) {
        return new BuildConfig(cacheDir, outputFile, workers, userAgent, http, retry, newSources, extraction, sampling);
    }

    public BuildConfig withSampling(SamplingSettings newSampling) {
        return new BuildConfig(cacheDir, outputFile, workers, userAgent, http, retry, sources, extraction, newSampling);
    }
}

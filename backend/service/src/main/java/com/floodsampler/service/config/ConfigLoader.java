package com.floodsampler.service.config;

import com.floodsampler.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static BuildConfig load(Path file, Map<String, String> environment) {
        BuildConfig config;
        if (Files.exists(file)) {
            config = read(file);
        } else {
            LOGGER.info("Config file " + file + " not found; using defaults");
            config = BuildConfig.defaults();
        }
        return applyEnvironment(config, environment);
    }

    static BuildConfig applyEnvironment(BuildConfig config, Map<String, String> environment) {
        BuildConfig result = config;
        String apiKey = environment.get("USGS_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            result = result.withSources(result.sources().withUsgsApiKey(apiKey.trim()));
        }
        String cacheDir = environment.get("FLOOD_DATASET_CACHE_DIR");
        if (cacheDir != null && !cacheDir.isBlank()) {
            result = result.withCacheDir(cacheDir.trim());
        }
        String output = environment.get("FLOOD_DATASET_OUTPUT");
        if (output != null && !output.isBlank()) {
            result = result.withOutputFile(output.trim());
        }
        String userAgent = environment.get("FLOOD_DATASET_USER_AGENT");
        if (userAgent != null && !userAgent.isBlank()) {
            result = result.withUserAgent(userAgent.trim());
        }
        return result;
    }

    private static BuildConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            BuildConfig config = JsonUtils.objectMapper().readValue(in, BuildConfig.class);
            if (config == null) {
                throw new IllegalStateException("Empty config file " + path);
            }
            return config;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}

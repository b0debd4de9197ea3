package com.floodsampler.service.config;

import com.floodsampler.core.model.AlertSeverity;
import com.floodsampler.core.sampling.GaugeCorroboration;
import com.floodsampler.core.sampling.NegativeSamplingConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileFallsBackToDefaults() {
        BuildConfig config = ConfigLoader.load(tempDir.resolve("absent.json"), Map.of());

        assertEquals("raw_data/cache", config.cacheDir());
        assertEquals(4, config.workers());
        assertEquals(3, config.retry().maxAttempts());
        assertEquals(NegativeSamplingConfig.defaults(), config.sampling().toConfig());
        assertEquals(AlertSeverity.ADVISORY, config.extraction().toConfig().minimumSeverity());
    }

    @Test
    void partialFileKeepsDefaultsForOmittedFields() throws Exception {
        Path file = tempDir.resolve("flood-dataset.json");
        Files.writeString(file, """
                {
                  "workers": 2,
                  "sources": {"floodStagesFt": {"08158000": 21.0}},
                  "extraction": {"corroboration": "STRICT", "gaugeSlack": "PT12H"},
                  "sampling": {"ratio": 2.5, "exclusionWindow": "PT72H", "seedBasis": 99}
                }
                """);

        BuildConfig config = ConfigLoader.load(file, Map.of());

        assertEquals(2, config.workers());
        assertEquals(21.0, config.sources().floodStagesFt().get("08158000"));
        assertEquals(GaugeCorroboration.STRICT, config.extraction().toConfig().corroboration());
        assertEquals(Duration.ofHours(12), config.extraction().toConfig().gaugeSlack());
        NegativeSamplingConfig sampling = config.sampling().toConfig();
        assertEquals(2.5, sampling.ratio());
        assertEquals(Duration.ofHours(72), sampling.exclusionWindow());
        assertEquals(99L, sampling.seedBasis());
        assertEquals(NegativeSamplingConfig.DEFAULT_EXCLUSION_RADIUS_KM, sampling.exclusionRadiusKm());
    }

    @Test
    void environmentOverridesFileValues() throws Exception {
        Path file = tempDir.resolve("flood-dataset.json");
        Files.writeString(file, "{\"cacheDir\": \"from-file\", \"sources\": {\"usgsApiKey\": \"file-key\"}}");

        BuildConfig config = ConfigLoader.load(file, Map.of(
                "USGS_API_KEY", " env-key ",
                "FLOOD_DATASET_CACHE_DIR", "/tmp/flood-cache",
                "FLOOD_DATASET_OUTPUT", "",
                "FLOOD_DATASET_USER_AGENT", "custom-agent"
        ));

        assertEquals("env-key", config.sources().usgsApiKey());
        assertEquals("/tmp/flood-cache", config.cacheDir());
        assertEquals("raw_data/flood_dataset.csv", config.outputFile());
        assertEquals("custom-agent", config.userAgent());
    }

    @Test
    void invalidFileFailsWithPath() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"workers\": ");
        Path zeroWorkers = tempDir.resolve("zero.json");
        Files.writeString(zeroWorkers, "{\"workers\": 0}");

        IllegalStateException syntax = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(broken, Map.of()));
        assertTrue(syntax.getMessage().contains(broken.toString()));
        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(zeroWorkers, Map.of()));
    }
}

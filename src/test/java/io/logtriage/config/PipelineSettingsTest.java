package io.logtriage.config;

import io.logtriage.Fixtures;
import io.logtriage.correlate.AdjacencyPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PipelineSettingsTest {
    private Path root;
    private LogTriageConfig config;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("logtriage-settings-test-");
        config = new LogTriageConfig(root);
    }

    @AfterEach
    void tearDown() throws Exception {
        Fixtures.deleteRecursively(root);
    }

    @Test
    void missingFileYieldsDefaults() {
        assertEquals(PipelineSettings.defaults(), PipelineSettings.load(config));
    }

    @Test
    void fileOverridesAndOutOfRangeValuesFallBack() throws Exception {
        Files.writeString(config.settingsFile(), """
                {"correlationWindowSeconds": 30,
                 "adjacencyPolicy": "surface-low-confidence",
                 "trendMinSamples": 1,
                 "poolThresholdRatio": 0.9,
                 "notifyChannel": "  #sre  "}
                """);

        PipelineSettings settings = PipelineSettings.load(config);

        assertEquals(30L, settings.correlationWindowSeconds());
        assertEquals(AdjacencyPolicy.SURFACE_LOW_CONFIDENCE, settings.adjacencyPolicy());
        assertEquals(PipelineSettings.DEFAULT_TREND_MIN_SAMPLES, settings.trendMinSamples());
        assertEquals(0.9, settings.poolThresholdRatio());
        assertEquals("#sre", settings.notifyChannel());
        assertEquals(PipelineSettings.DEFAULT_MAX_PARALLEL_STAGES, settings.maxParallelStages());
    }

    @Test
    void unreadableFileIsAConfigurationError() throws Exception {
        Files.writeString(config.settingsFile(), "{not json");
        assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(config));
    }

    @Test
    void unknownPolicyIsRejected() throws Exception {
        Files.writeString(config.settingsFile(), "{\"adjacencyPolicy\": \"sometimes\"}");
        assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(config));
    }

    @Test
    void withersOnlyChangeTheirField() {
        PipelineSettings changed = PipelineSettings.defaults().withRunTimeoutMs(5_000L);
        assertEquals(5_000L, changed.runTimeoutMs());
        assertEquals(PipelineSettings.defaults().withRunTimeoutMs(5_000L), changed);
        assertEquals(PipelineSettings.DEFAULT_CORRELATION_WINDOW_SECONDS, changed.correlationWindowSeconds());
    }
}

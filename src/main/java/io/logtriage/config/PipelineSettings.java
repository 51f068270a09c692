package io.logtriage.config;

import io.logtriage.correlate.AdjacencyPolicy;
import io.logtriage.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record PipelineSettings(
        long correlationWindowSeconds,
        AdjacencyPolicy adjacencyPolicy,
        int minClusterServices,
        double accelerationToleranceSeconds,
        int trendMinSamples,
        int bruteForceThreshold,
        double diskThresholdPercent,
        double poolThresholdRatio,
        int retryMinSamples,
        int maxParallelStages,
        long runTimeoutMs,
        long reasonerTimeoutMs,
        int remediationIssueLimit,
        String notifyChannel
) {
    public static final long DEFAULT_CORRELATION_WINDOW_SECONDS = 60L;
    public static final int DEFAULT_MIN_CLUSTER_SERVICES = 2;
    public static final double DEFAULT_ACCELERATION_TOLERANCE_SECONDS = 0.5;
    public static final int DEFAULT_TREND_MIN_SAMPLES = 3;
    public static final int DEFAULT_BRUTE_FORCE_THRESHOLD = 3;
    public static final double DEFAULT_DISK_THRESHOLD_PERCENT = 80.0;
    public static final double DEFAULT_POOL_THRESHOLD_RATIO = 0.75;
    public static final int DEFAULT_RETRY_MIN_SAMPLES = 2;
    public static final int DEFAULT_MAX_PARALLEL_STAGES = 4;
    public static final long DEFAULT_RUN_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_REASONER_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_REMEDIATION_ISSUE_LIMIT = 10;
    public static final String DEFAULT_NOTIFY_CHANNEL = "#incidents";

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                DEFAULT_CORRELATION_WINDOW_SECONDS,
                AdjacencyPolicy.DROP,
                DEFAULT_MIN_CLUSTER_SERVICES,
                DEFAULT_ACCELERATION_TOLERANCE_SECONDS,
                DEFAULT_TREND_MIN_SAMPLES,
                DEFAULT_BRUTE_FORCE_THRESHOLD,
                DEFAULT_DISK_THRESHOLD_PERCENT,
                DEFAULT_POOL_THRESHOLD_RATIO,
                DEFAULT_RETRY_MIN_SAMPLES,
                DEFAULT_MAX_PARALLEL_STAGES,
                DEFAULT_RUN_TIMEOUT_MS,
                DEFAULT_REASONER_TIMEOUT_MS,
                DEFAULT_REMEDIATION_ISSUE_LIMIT,
                DEFAULT_NOTIFY_CHANNEL
        );
    }

    public PipelineSettings withAdjacencyPolicy(AdjacencyPolicy policy) {
        return new PipelineSettings(correlationWindowSeconds, policy, minClusterServices,
                accelerationToleranceSeconds, trendMinSamples, bruteForceThreshold, diskThresholdPercent,
                poolThresholdRatio, retryMinSamples, maxParallelStages, runTimeoutMs, reasonerTimeoutMs,
                remediationIssueLimit, notifyChannel);
    }

    public PipelineSettings withRunTimeoutMs(long timeoutMs) {
        return new PipelineSettings(correlationWindowSeconds, adjacencyPolicy, minClusterServices,
                accelerationToleranceSeconds, trendMinSamples, bruteForceThreshold, diskThresholdPercent,
                poolThresholdRatio, retryMinSamples, maxParallelStages, timeoutMs, reasonerTimeoutMs,
                remediationIssueLimit, notifyChannel);
    }

    /**
     * Reads the settings file under the config root. A missing file yields defaults; a file that
     * exists but cannot be parsed is a configuration error.
     */
    public static PipelineSettings load(LogTriageConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            PipelineSettingsFile parsed = Jsons.mapper().readValue(file.toFile(), PipelineSettingsFile.class);
            return fromFile(parsed, defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + file + ": " + e.getMessage(), e);
        }
    }

    static PipelineSettings fromFile(PipelineSettingsFile file, PipelineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new PipelineSettings(
                sanitizeLong(file.correlationWindowSeconds(), defaults.correlationWindowSeconds(), 1L),
                file.adjacencyPolicy() == null ? defaults.adjacencyPolicy() : AdjacencyPolicy.fromString(file.adjacencyPolicy()),
                sanitizeInt(file.minClusterServices(), defaults.minClusterServices(), 1),
                sanitizeDouble(file.accelerationToleranceSeconds(), defaults.accelerationToleranceSeconds(), 0.0),
                sanitizeInt(file.trendMinSamples(), defaults.trendMinSamples(), 2),
                sanitizeInt(file.bruteForceThreshold(), defaults.bruteForceThreshold(), 2),
                sanitizeDouble(file.diskThresholdPercent(), defaults.diskThresholdPercent(), 0.0),
                sanitizeDouble(file.poolThresholdRatio(), defaults.poolThresholdRatio(), 0.0),
                sanitizeInt(file.retryMinSamples(), defaults.retryMinSamples(), 2),
                sanitizeInt(file.maxParallelStages(), defaults.maxParallelStages(), 1),
                sanitizeLong(file.runTimeoutMs(), defaults.runTimeoutMs(), 1_000L),
                sanitizeLong(file.reasonerTimeoutMs(), defaults.reasonerTimeoutMs(), 1_000L),
                sanitizeInt(file.remediationIssueLimit(), defaults.remediationIssueLimit(), 0),
                file.notifyChannel() == null || file.notifyChannel().isBlank()
                        ? defaults.notifyChannel()
                        : file.notifyChannel().trim()
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static double sanitizeDouble(Double value, double fallback, double min) {
        if (value == null || value.isNaN() || value < min) {
            return fallback;
        }
        return value;
    }
}

package io.logtriage.config;

/**
 * On-disk shape of {@code logtriage-settings.json}. Every field is optional.
 */
public record PipelineSettingsFile(
        Long correlationWindowSeconds,
        String adjacencyPolicy,
        Integer minClusterServices,
        Double accelerationToleranceSeconds,
        Integer trendMinSamples,
        Integer bruteForceThreshold,
        Double diskThresholdPercent,
        Double poolThresholdRatio,
        Integer retryMinSamples,
        Integer maxParallelStages,
        Long runTimeoutMs,
        Long reasonerTimeoutMs,
        Integer remediationIssueLimit,
        String notifyChannel
) {
}

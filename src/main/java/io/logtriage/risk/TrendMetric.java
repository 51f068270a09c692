package io.logtriage.risk;

public enum TrendMetric {
    DISK_PERCENT("disk_percent", false),
    CPU_PERCENT("cpu_percent", false),
    MEMORY_PERCENT("memory_percent", false),
    LATENCY_MS("latency_ms", false),
    RETRY_COUNT("retry_count", false),
    POOL_UTILIZATION("pool_utilization", false),
    FREE_CAPACITY("free_capacity", true);

    private final String metricName;
    private final boolean lowerIsWorse;

    TrendMetric(String metricName, boolean lowerIsWorse) {
        this.metricName = metricName;
        this.lowerIsWorse = lowerIsWorse;
    }

    public String metricName() {
        return metricName;
    }

    public boolean lowerIsWorse() {
        return lowerIsWorse;
    }
}

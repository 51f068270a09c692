package io.logtriage.correlate;

/**
 * What to do with a temporal cluster whose services do not reference each other.
 */
public enum AdjacencyPolicy {
    /** Discard the cluster; no chain is emitted for it. */
    DROP,
    /** Keep the cluster but cap the resulting chain's confidence at LOW. */
    SURFACE_LOW_CONFIDENCE;

    public static AdjacencyPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DROP;
        }
        String normalized = raw.trim().replace('-', '_');
        for (AdjacencyPolicy value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown adjacency policy: " + raw);
    }
}

package io.logtriage.model;

import java.util.Optional;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static Optional<RiskLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (RiskLevel value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

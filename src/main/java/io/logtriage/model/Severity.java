package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHighOrWorse() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonCreator
    public static Severity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (Severity value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + raw);
    }
}

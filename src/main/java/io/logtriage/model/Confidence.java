package io.logtriage.model;

import java.util.Optional;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    public static Optional<Confidence> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (Confidence value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

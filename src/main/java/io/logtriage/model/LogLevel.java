package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum LogLevel {
    INFO,
    WARN,
    ERROR,
    CRITICAL;

    public boolean isWarningOrWorse() {
        return this != INFO;
    }

    @JsonCreator
    public static LogLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String normalized = raw.trim().toUpperCase();
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        if ("FATAL".equals(normalized)) {
            return CRITICAL;
        }
        for (LogLevel value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        return INFO;
    }
}

package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public record LogEntry(
        String timestamp,
        LogLevel level,
        String service,
        String message,
        @JsonProperty("line_number") int lineNumber
) {
    public LogEntry {
        timestamp = timestamp == null ? "" : timestamp.trim();
        level = level == null ? LogLevel.INFO : level;
        // One canonical spelling per service.
        service = service == null || service.isBlank() ? "unknown" : service.trim().toLowerCase(Locale.ROOT);
        message = message == null ? "" : message;
    }

    /**
     * Compact reference used as risk evidence and in reasoner prompts.
     */
    public String reference() {
        return "line " + lineNumber + " [" + timestamp + "] " + service + ": " + message;
    }
}

package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChainEvent(
        String service,
        String event,
        String timestamp,
        @JsonProperty("line_number") int lineNumber
) {
    public static ChainEvent of(LogEntry entry) {
        return new ChainEvent(entry.service(), entry.message(), entry.timestamp(), entry.lineNumber());
    }
}

package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Issue(
        String description,
        Severity severity,
        @JsonProperty("line_number") int lineNumber
) {
    public Issue {
        description = description == null ? "" : description.trim();
        severity = severity == null ? Severity.MEDIUM : severity;
    }
}

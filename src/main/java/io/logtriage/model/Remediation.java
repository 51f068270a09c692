package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Remediation(
        String issue,
        Severity severity,
        @JsonProperty("line_number") int lineNumber,
        List<String> steps,
        String rationale
) {
    public Remediation {
        steps = steps == null ? List.of() : List.copyOf(steps);
        rationale = rationale == null ? "" : rationale;
    }
}

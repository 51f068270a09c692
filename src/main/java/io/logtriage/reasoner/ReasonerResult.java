package io.logtriage.reasoner;

import com.fasterxml.jackson.databind.JsonNode;

public record ReasonerResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ReasonerResult ok(JsonNode output) {
        return new ReasonerResult(true, output, null);
    }

    public static ReasonerResult fail(String error) {
        return new ReasonerResult(false, null, error);
    }
}

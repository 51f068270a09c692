package io.logtriage.correlate;

import com.fasterxml.jackson.databind.JsonNode;
import io.logtriage.model.CausalChain;
import io.logtriage.model.Confidence;

import java.util.Optional;

/**
 * Validates a reasoner answer for one candidate against the causal chain shape.
 */
final class ChainResponseParser {
    private ChainResponseParser() {
    }

    static Parsed parse(JsonNode output, CorrelationCandidate candidate) {
        if (output == null || !output.isObject()) {
            return Parsed.malformed("expected a JSON object");
        }
        if (output.has("causal") && !output.path("causal").asBoolean(true)) {
            return Parsed.independent();
        }
        String rootCause = output.path("root_cause").asText("").trim();
        if (rootCause.isEmpty()) {
            return Parsed.malformed("missing root_cause");
        }
        String summary = output.path("summary").asText("").trim();
        if (summary.isEmpty()) {
            return Parsed.malformed("missing summary");
        }
        Optional<Confidence> confidence = Confidence.parse(output.path("confidence").asText(""));
        if (confidence.isEmpty()) {
            return Parsed.malformed("invalid confidence: " + output.path("confidence").asText("<missing>"));
        }
        Confidence effective = candidate.adjacent() ? confidence.get() : Confidence.LOW;
        return Parsed.chain(new CausalChain(candidate.chainEvents(), rootCause, effective, summary));
    }

    record Parsed(CausalChain chain, String error) {
        static Parsed chain(CausalChain chain) {
            return new Parsed(chain, null);
        }

        static Parsed independent() {
            return new Parsed(null, null);
        }

        static Parsed malformed(String error) {
            return new Parsed(null, error);
        }

        boolean malformed() {
            return error != null;
        }
    }
}

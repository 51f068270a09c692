package io.logtriage.risk;

import com.fasterxml.jackson.databind.JsonNode;
import io.logtriage.model.RiskLevel;
import io.logtriage.model.RiskPrediction;

import java.util.Optional;

final class RiskResponseParser {
    private RiskResponseParser() {
    }

    static Parsed parse(JsonNode output, EvidenceBundle bundle) {
        JsonNode node = output;
        // Some reasoners answer with a one-element array.
        if (node != null && node.isArray()) {
            node = node.size() == 1 ? node.get(0) : null;
        }
        if (node == null || !node.isObject()) {
            return Parsed.malformed("expected a JSON object");
        }
        Optional<RiskLevel> level = RiskLevel.parse(node.path("risk_level").asText(""));
        if (level.isEmpty()) {
            return Parsed.malformed("invalid risk_level: " + node.path("risk_level").asText("<missing>"));
        }
        String prediction = node.path("prediction").asText("").trim();
        if (prediction.isEmpty()) {
            return Parsed.malformed("missing prediction");
        }
        String action = node.path("preventive_action").asText("").trim();
        if (action.isEmpty()) {
            return Parsed.malformed("missing preventive_action");
        }
        String horizon = node.path("time_horizon").asText("");
        return Parsed.ok(new RiskPrediction(bundle.service(), level.get(), prediction, bundle.references(),
                action, horizon));
    }

    record Parsed(RiskPrediction prediction, String error) {
        static Parsed ok(RiskPrediction prediction) {
            return new Parsed(prediction, null);
        }

        static Parsed malformed(String error) {
            return new Parsed(null, error);
        }
    }
}

package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RiskPrediction(
        String service,
        @JsonProperty("risk_level") RiskLevel riskLevel,
        String prediction,
        List<String> evidence,
        @JsonProperty("preventive_action") String preventiveAction,
        @JsonProperty("time_horizon") String timeHorizon
) {
    public RiskPrediction {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        if (riskLevel != RiskLevel.LOW && evidence.isEmpty()) {
            throw new IllegalArgumentException("risk prediction for " + service + " needs evidence");
        }
        timeHorizon = timeHorizon == null || timeHorizon.isBlank() ? "unknown" : timeHorizon.trim();
    }
}

package io.logtriage.stage;

import io.logtriage.model.RiskLevel;
import io.logtriage.model.RiskPrediction;
import io.logtriage.state.SharedState;

import java.util.List;

public record StageContext(
        String runId,
        StageId stageId,
        String traceId,
        String spanId,
        SharedState state
) {
    /**
     * Risk predictions filtered to HIGH. Empty when none qualify or the risk stage failed, never
     * null.
     */
    public List<RiskPrediction> highRiskPredictions() {
        return state.riskPredictions().stream()
                .filter(p -> p.riskLevel() == RiskLevel.HIGH)
                .toList();
    }
}

package io.logtriage.observability;

import io.logtriage.Fixtures;
import io.logtriage.model.RiskLevel;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.runtime.RunOutcome;
import io.logtriage.runtime.RunStatus;
import io.logtriage.stage.StageId;
import io.logtriage.state.Reducers;
import io.logtriage.state.SharedState;
import io.logtriage.state.StateUpdate;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusFormatterTest {
    @Test
    void rendersStageRunAndResultGauges() {
        SharedState state = SharedState.initial(Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues());
        state = Reducers.fail(state, StageId.ROOT_CAUSE,
                StageError.of(StageId.ROOT_CAUSE, StageErrorKind.STAGE_FAILED, "boom"));
        state = Reducers.merge(state, StageId.PREDICTIVE_RISK, StateUpdate.builder()
                .riskPredictions(List.of(new RiskPrediction("auth-service", RiskLevel.HIGH, "lockout",
                        List.of("line 1"), "rate limit", "minutes")))
                .softError(StageError.about(StageId.PREDICTIVE_RISK, StageErrorKind.REASONER_FAILED, "db", "timeout"))
                .build());
        Map<StageId, Long> durations = new LinkedHashMap<>();
        durations.put(StageId.CLASSIFY, 3L);
        durations.put(StageId.PREDICTIVE_RISK, 40L);

        String text = PrometheusFormatter.format(
                new RunOutcome("run-1", "trace", RunStatus.COMPLETED, null, 57L, durations, state));

        assertTrue(text.contains("logtriage_stage_duration_ms{stage=\"predictive_risk\"} 40\n"));
        assertTrue(text.contains("logtriage_soft_errors_total{kind=\"STAGE_FAILED\"} 1\n"));
        assertTrue(text.contains("logtriage_soft_errors_total{kind=\"REASONER_FAILED\"} 1\n"));
        assertTrue(text.contains("logtriage_run_duration_ms 57\n"));
        assertTrue(text.contains("logtriage_run_cancelled 0\n"));
        assertTrue(text.contains("logtriage_log_entries_total 4\n"));
        assertTrue(text.contains("logtriage_risk_predictions_total 1\n"));
        assertTrue(text.contains("logtriage_failed_stages_total 1\n"));
        assertTrue(text.contains("# TYPE logtriage_causal_chains_total gauge\n"));
    }
}

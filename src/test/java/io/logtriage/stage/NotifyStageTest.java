package io.logtriage.stage;

import io.logtriage.Fixtures;
import io.logtriage.model.Notification;
import io.logtriage.model.RiskLevel;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.HeuristicReasoner;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.reasoner.ScriptedReasoner;
import io.logtriage.state.Reducers;
import io.logtriage.state.SharedState;
import io.logtriage.state.StateUpdate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class NotifyStageTest {
    private final NotifyStage stage = new NotifyStage("#ops");

    @Test
    void nothingToReportSkipsTheReasoner() {
        ScriptedReasoner reasoner = ScriptedReasoner.always("{\"summary\": \"should not be used\"}");

        StateUpdate update = stage.execute(Fixtures.context(StageId.NOTIFY, List.of(), List.of()), reasoner);

        Notification notification = update.notification();
        Assertions.assertEquals(NotifyStage.NOTHING_TO_REPORT, notification.summary());
        Assertions.assertEquals("#ops", notification.channel());
        Assertions.assertFalse(notification.sent());
        Assertions.assertEquals(Notification.DRY_RUN, notification.mode());
        Assertions.assertEquals(0, reasoner.calls());
    }

    @Test
    void onlyHighRisksAreForwarded() {
        SharedState state = Reducers.merge(
                SharedState.initial(Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues()),
                StageId.PREDICTIVE_RISK,
                StateUpdate.builder().riskPredictions(List.of(
                        new RiskPrediction("auth-service", RiskLevel.HIGH, "lockout", List.of("line 1"), "rate limit", "minutes"),
                        new RiskPrediction("db", RiskLevel.LOW, "meh", List.of(), "watch", null)
                )).build());
        ScriptedReasoner reasoner = new ScriptedReasoner(new HeuristicReasoner()::reason);

        Notification notification = stage.execute(Fixtures.context(StageId.NOTIFY, state), reasoner).notification();

        Assertions.assertEquals(1, notification.highRisks().size());
        Assertions.assertEquals("auth-service", notification.highRisks().get(0).service());
        Assertions.assertEquals(2, notification.issueCount());
        Assertions.assertTrue(notification.summary().startsWith("*[CRITICAL] 2 issue(s) detected*"));
        Assertions.assertTrue(notification.summary().contains("rate limit"));
        Assertions.assertEquals(ReasonerTask.NOTIFICATION_SUMMARY, reasoner.requests().get(0).task());
        Assertions.assertEquals(1, reasoner.requests().get(0).context().path("high_risks").size());
    }

    @Test
    void reasonerFailureFallsBackToTemplateSummary() {
        StateUpdate update = stage.execute(
                Fixtures.context(StageId.NOTIFY, Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues()),
                ScriptedReasoner.failing("quota exceeded"));

        Assertions.assertTrue(update.notification().summary().startsWith("[CRITICAL] 2 issue(s) detected"));
        Assertions.assertEquals(StageErrorKind.REASONER_FAILED, update.softErrors().get(0).kind());
    }

    @Test
    void blankSummaryIsMalformed() {
        StateUpdate update = stage.execute(
                Fixtures.context(StageId.NOTIFY, List.of(), Fixtures.authPaymentIssues()),
                ScriptedReasoner.always("{\"summary\": \"  \"}"));

        Assertions.assertEquals(StageErrorKind.MALFORMED_OUTPUT, update.softErrors().get(0).kind());
        Assertions.assertFalse(update.notification().summary().isBlank());
    }
}

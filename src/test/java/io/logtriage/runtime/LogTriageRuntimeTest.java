package io.logtriage.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.Fixtures;
import io.logtriage.config.LogTriageConfig;
import io.logtriage.config.PipelineSettings;
import io.logtriage.model.LogLevel;
import io.logtriage.model.RiskLevel;
import io.logtriage.model.Severity;
import io.logtriage.observability.AuditVerifier;
import io.logtriage.reasoner.HeuristicReasoner;
import io.logtriage.reasoner.ScriptedReasoner;
import io.logtriage.stage.NotifyStage;
import io.logtriage.stage.StageId;
import io.logtriage.state.SharedState;
import io.logtriage.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class LogTriageRuntimeTest {
    private Path root;
    private LogTriageRuntime runtime;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("logtriage-runtime-test-");
        runtime = new LogTriageRuntime(new LogTriageConfig(root), PipelineSettings.defaults());
    }

    @AfterEach
    void tearDown() throws Exception {
        Fixtures.deleteRecursively(root);
    }

    @Test
    void authPaymentIncidentRunsEndToEnd() {
        RunOutcome outcome = runtime.analyze(
                new AnalysisInput(Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues()),
                new HeuristicReasoner());

        SharedState state = outcome.finalState();
        Assertions.assertEquals(RunStatus.COMPLETED, outcome.status());
        Assertions.assertFalse(outcome.degraded());
        Assertions.assertEquals(7, state.completedStages().size());
        Assertions.assertTrue(state.failedStages().isEmpty());
        Assertions.assertNotNull(state.lastCompletedStage());
        Assertions.assertTrue(state.isComplete(StageId.NOTIFY));

        Assertions.assertEquals(1, state.causalChains().size());
        Assertions.assertTrue(state.causalChains().get(0).rootCause().startsWith("auth-service"));
        Assertions.assertEquals(1, state.riskPredictions().size());
        Assertions.assertEquals(RiskLevel.HIGH, state.riskPredictions().get(0).riskLevel());
        Assertions.assertEquals(2, state.remediations().size());
        Assertions.assertEquals(2, state.cookbook().sections());
        Assertions.assertEquals(2, state.tickets().size());
        Assertions.assertEquals(1, state.notification().highRisks().size());
        Assertions.assertEquals(4, state.logSummary().totalEntries());
        Assertions.assertEquals(7, outcome.stageDurationsMs().size());
    }

    @Test
    void repeatedRunsProduceTheSameState() {
        AnalysisInput input = new AnalysisInput(Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues());

        ObjectNode first = Jsons.mapper().valueToTree(runtime.analyze(input, new HeuristicReasoner()).finalState());
        ObjectNode second = Jsons.mapper().valueToTree(runtime.analyze(input, new HeuristicReasoner()).finalState());
        // Which terminal stage finishes last varies between runs.
        first.remove("last_completed_stage");
        second.remove("last_completed_stage");

        Assertions.assertEquals(first, second);
    }

    @Test
    void quietLogIsCleanAndNotDegraded() {
        ScriptedReasoner reasoner = new ScriptedReasoner(new HeuristicReasoner()::reason);
        RunOutcome outcome = runtime.analyze(new AnalysisInput(
                List.of(Fixtures.info(1, "10:00:00", "api", "service started")), List.of()), reasoner);

        Assertions.assertTrue(outcome.completed());
        Assertions.assertFalse(outcome.degraded());
        Assertions.assertTrue(outcome.finalState().causalChains().isEmpty());
        Assertions.assertTrue(outcome.finalState().riskPredictions().isEmpty());
        Assertions.assertEquals(NotifyStage.NOTHING_TO_REPORT, outcome.finalState().notification().summary());
        Assertions.assertEquals(0, reasoner.calls());
    }

    @Test
    void failingReasonerDegradesButCompletes() {
        RunOutcome outcome = runtime.analyze(
                new AnalysisInput(Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues()),
                ScriptedReasoner.failing("offline"));

        Assertions.assertTrue(outcome.completed());
        Assertions.assertTrue(outcome.degraded());
        Assertions.assertTrue(outcome.finalState().failedStages().isEmpty());
        Assertions.assertNotNull(outcome.finalState().notification());
        Assertions.assertFalse(outcome.finalState().notification().summary().isBlank());
    }

    @Test
    void runsAreAuditedAndTheChainVerifies() throws Exception {
        runtime.analyze(new AnalysisInput(Fixtures.authPaymentIncident(), List.of()), new HeuristicReasoner());

        AuditVerifier.AuditIntegrityOutcome outcome = runtime.verifyAudit(0);

        Assertions.assertTrue(outcome.ok(), outcome.reason());
        Assertions.assertTrue(outcome.checkedRows() >= 9);
        Assertions.assertTrue(Files.exists(root.resolve("security").resolve("audit-signing.key")));
        Assertions.assertTrue(Files.size(root.resolve("trace").resolve("otel-spans.jsonl")) > 0);

        LogTriageRuntime reopened = new LogTriageRuntime(new LogTriageConfig(root), PipelineSettings.defaults());
        Assertions.assertTrue(reopened.verifyAudit(0).ok());
    }

    @Test
    void readsInputFileAndNumbersEntries() throws Exception {
        Path file = root.resolve("input.json");
        Files.writeString(file, """
                {"entries": [
                  {"timestamp": "2024-03-01 10:00:00", "level": "WARNING", "service": "api", "message": "slow"},
                  {"timestamp": "2024-03-01 10:00:01", "level": "ERROR", "service": "db", "message": "down", "line_number": 40}
                ],
                 "issues": [{"description": "db down", "severity": "critical", "line_number": 40}]}
                """);

        AnalysisInput input = AnalysisInput.read(file);

        Assertions.assertEquals(1, input.entries().get(0).lineNumber());
        Assertions.assertEquals(40, input.entries().get(1).lineNumber());
        Assertions.assertEquals(LogLevel.WARN, input.entries().get(0).level());
        Assertions.assertEquals(Severity.CRITICAL, input.issues().get(0).severity());
        Assertions.assertThrows(IllegalArgumentException.class, () -> AnalysisInput.read(root.resolve("missing.json")));
    }
}

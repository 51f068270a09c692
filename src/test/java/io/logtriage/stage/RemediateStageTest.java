package io.logtriage.stage;

import io.logtriage.Fixtures;
import io.logtriage.model.Issue;
import io.logtriage.model.Remediation;
import io.logtriage.model.Severity;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.HeuristicReasoner;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ScriptedReasoner;
import io.logtriage.state.StateUpdate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemediateStageTest {
    private static final List<Issue> ISSUES = List.of(
            Fixtures.issue("cache miss ratio high", Severity.LOW, 7),
            Fixtures.issue("connection pool exhausted", Severity.CRITICAL, 12),
            Fixtures.issue("login failures for admin", Severity.HIGH, 3)
    );

    @Test
    void remediatesMostSevereIssuesFirstUpToTheLimit() {
        StateUpdate update = new RemediateStage(2).execute(
                Fixtures.context(StageId.REMEDIATE, List.of(), ISSUES), new HeuristicReasoner());

        List<Remediation> remediations = update.remediations();
        assertEquals(2, remediations.size());
        assertEquals(12, remediations.get(0).lineNumber());
        assertEquals(3, remediations.get(1).lineNumber());
        assertFalse(remediations.get(0).steps().isEmpty());
        assertTrue(remediations.get(0).steps().get(0).toLowerCase().contains("pool"));
    }

    @Test
    void emptyStepsAreMalformedAndFailuresAreRecorded() {
        ScriptedReasoner reasoner = new ScriptedReasoner(request -> {
            int line = request.context().path("line_number").asInt();
            if (line == 12) {
                return ReasonerResult.ok(ScriptedReasoner.json("{\"steps\": []}"));
            }
            if (line == 3) {
                return ReasonerResult.fail("timeout");
            }
            return ReasonerResult.ok(ScriptedReasoner.json("{\"steps\": [\"warm the cache\"], \"rationale\": \"cold start\"}"));
        });

        StateUpdate update = new RemediateStage(10).execute(
                Fixtures.context(StageId.REMEDIATE, List.of(), ISSUES), reasoner);

        assertEquals(1, update.remediations().size());
        assertEquals(List.of("warm the cache"), update.remediations().get(0).steps());
        assertEquals(2, update.softErrors().size());
        assertEquals(StageErrorKind.MALFORMED_OUTPUT, update.softErrors().get(0).kind());
        assertEquals("issue at line 12", update.softErrors().get(0).subject());
        assertEquals(StageErrorKind.REASONER_FAILED, update.softErrors().get(1).kind());
    }

    @Test
    void zeroLimitSkipsTheReasoner() {
        ScriptedReasoner reasoner = ScriptedReasoner.always("{}");
        StateUpdate update = new RemediateStage(0).execute(
                Fixtures.context(StageId.REMEDIATE, List.of(), ISSUES), reasoner);
        assertTrue(update.remediations().isEmpty());
        assertEquals(0, reasoner.calls());
    }
}

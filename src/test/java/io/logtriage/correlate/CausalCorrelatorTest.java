package io.logtriage.correlate;

import com.fasterxml.jackson.databind.JsonNode;
import io.logtriage.Fixtures;
import io.logtriage.config.PipelineSettings;
import io.logtriage.model.CausalChain;
import io.logtriage.model.Confidence;
import io.logtriage.model.LogEntry;
import io.logtriage.model.Severity;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.HeuristicReasoner;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.reasoner.ScriptedReasoner;
import io.logtriage.stage.StageId;
import io.logtriage.state.StateUpdate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

final class CausalCorrelatorTest {
    private static final String VALID_CHAIN = """
            {"causal": true, "root_cause": "db saturated", "confidence": "HIGH", "summary": "db took api down"}
            """;

    private final CausalCorrelator correlator = new CausalCorrelator(PipelineSettings.defaults());

    @Test
    void authFailuresExplainPaymentOutage() {
        StateUpdate update = correlator.execute(
                Fixtures.context(StageId.ROOT_CAUSE, Fixtures.authPaymentIncident(), Fixtures.authPaymentIssues()),
                new HeuristicReasoner()
        );

        Assertions.assertEquals(1, update.causalChains().size());
        CausalChain chain = update.causalChains().get(0);
        Assertions.assertEquals(List.of(1, 2, 3, 4), chain.chain().stream().map(e -> e.lineNumber()).toList());
        Assertions.assertEquals(Set.of("auth-service", "payment-service"), chain.affectedServices());
        Assertions.assertEquals(2, chain.blastRadius());
        Assertions.assertTrue(chain.rootCause().startsWith("auth-service"));
        Assertions.assertEquals(Confidence.HIGH, chain.confidence());
        Assertions.assertTrue(update.softErrors().isEmpty());
    }

    @Test
    void promptContextCarriesEventsAndMasksSecrets() {
        ScriptedReasoner reasoner = ScriptedReasoner.always(VALID_CHAIN);
        List<LogEntry> entries = List.of(
                Fixtures.error(1, "10:00:00", "db", "login rejected password=hunter2"),
                Fixtures.error(2, "10:00:10", "api", "query to db failed")
        );

        correlator.execute(Fixtures.context(StageId.ROOT_CAUSE, entries, List.of(Fixtures.issue("api query failed", Severity.HIGH, 2))), reasoner);

        Assertions.assertEquals(1, reasoner.calls());
        Assertions.assertEquals(ReasonerTask.CAUSAL_CHAIN, reasoner.requests().get(0).task());
        JsonNode context = reasoner.requests().get(0).context();
        Assertions.assertEquals("login rejected password=***", context.path("events").get(0).path("event").asText());
        Assertions.assertFalse(context.path("events").get(0).path("reported_issue").asBoolean());
        Assertions.assertTrue(context.path("events").get(1).path("reported_issue").asBoolean());
        Assertions.assertEquals("api", context.path("known_services").get(0).asText());
        Assertions.assertTrue(context.path("adjacent").asBoolean());
    }

    @Test
    void nonAdjacentClusterIsDroppedByDefault() {
        List<LogEntry> entries = List.of(
                Fixtures.error(1, "10:00:00", "search", "index corrupt"),
                Fixtures.error(2, "10:00:05", "mailer", "smtp refused")
        );
        ScriptedReasoner reasoner = ScriptedReasoner.always(VALID_CHAIN);

        StateUpdate update = correlator.execute(Fixtures.context(StageId.ROOT_CAUSE, entries, List.of()), reasoner);

        Assertions.assertEquals(0, reasoner.calls());
        Assertions.assertTrue(update.causalChains().isEmpty());
    }

    @Test
    void nonAdjacentClusterCanBeSurfacedWithLowConfidence() {
        CausalCorrelator surfacing = new CausalCorrelator(
                PipelineSettings.defaults().withAdjacencyPolicy(AdjacencyPolicy.SURFACE_LOW_CONFIDENCE));
        List<LogEntry> entries = List.of(
                Fixtures.error(1, "10:00:00", "search", "index corrupt"),
                Fixtures.error(2, "10:00:05", "mailer", "smtp refused")
        );
        ScriptedReasoner reasoner = ScriptedReasoner.always(VALID_CHAIN);

        StateUpdate update = surfacing.execute(Fixtures.context(StageId.ROOT_CAUSE, entries, List.of()), reasoner);

        Assertions.assertFalse(reasoner.requests().get(0).context().path("adjacent").asBoolean(true));
        Assertions.assertEquals(1, update.causalChains().size());
        Assertions.assertEquals(Confidence.LOW, update.causalChains().get(0).confidence());
    }

    @Test
    void failedCandidateDoesNotBlockTheNextOne() {
        List<LogEntry> entries = List.of(
                Fixtures.error(1, "10:00:00", "db", "disk full"),
                Fixtures.error(2, "10:00:05", "api", "db unavailable"),
                Fixtures.error(3, "11:00:00", "cache", "evictions spiking"),
                Fixtures.error(4, "11:00:05", "web", "cache misses slow pages")
        );
        ScriptedReasoner reasoner = new ScriptedReasoner(request -> {
            String first = request.context().path("events").get(0).path("service").asText();
            if (first.equals("db")) {
                return ReasonerResult.fail("model overloaded");
            }
            return ReasonerResult.ok(ScriptedReasoner.json(VALID_CHAIN));
        });

        StateUpdate update = correlator.execute(Fixtures.context(StageId.ROOT_CAUSE, entries, List.of()), reasoner);

        Assertions.assertEquals(2, reasoner.calls());
        Assertions.assertEquals(1, update.causalChains().size());
        Assertions.assertEquals(Set.of("cache", "web"), update.causalChains().get(0).affectedServices());
        Assertions.assertEquals(1, update.softErrors().size());
        Assertions.assertEquals(StageErrorKind.REASONER_FAILED, update.softErrors().get(0).kind());
        Assertions.assertTrue(update.softErrors().get(0).subject().contains("lines 1-2"));
    }

    @Test
    void invalidConfidenceIsMalformed() {
        ScriptedReasoner reasoner = ScriptedReasoner.always("""
                {"root_cause": "db", "confidence": "VERY_SURE", "summary": "db broke api"}
                """);

        StateUpdate update = correlator.execute(
                Fixtures.context(StageId.ROOT_CAUSE, Fixtures.authPaymentIncident(), List.of()), reasoner);

        Assertions.assertTrue(update.causalChains().isEmpty());
        Assertions.assertEquals(StageErrorKind.MALFORMED_OUTPUT, update.softErrors().get(0).kind());
    }

    @Test
    void throwingReasonerBecomesSoftError() {
        ScriptedReasoner reasoner = new ScriptedReasoner(request -> {
            throw new IllegalStateException("socket closed");
        });

        StateUpdate update = correlator.execute(
                Fixtures.context(StageId.ROOT_CAUSE, Fixtures.authPaymentIncident(), List.of()), reasoner);

        Assertions.assertTrue(update.causalChains().isEmpty());
        Assertions.assertEquals(StageErrorKind.REASONER_FAILED, update.softErrors().get(0).kind());
        Assertions.assertTrue(update.softErrors().get(0).message().contains("socket closed"));
    }

    @Test
    void reasonerMayDeclareClusterIndependent() {
        StateUpdate update = correlator.execute(
                Fixtures.context(StageId.ROOT_CAUSE, Fixtures.authPaymentIncident(), List.of()),
                ScriptedReasoner.always("{\"causal\": false}"));

        Assertions.assertTrue(update.causalChains().isEmpty());
        Assertions.assertTrue(update.softErrors().isEmpty());
    }

    @Test
    void singleServiceAndEmptyInputsProduceNoCandidates() {
        Assertions.assertTrue(correlator.candidates(List.of()).isEmpty());
        Assertions.assertTrue(correlator.candidates(List.of(
                Fixtures.error(1, "10:00:00", "api", "boom"),
                Fixtures.error(2, "10:00:01", "api", "boom again")
        )).isEmpty());
        Assertions.assertTrue(correlator.candidates(List.of(
                Fixtures.info(1, "10:00:00", "api", "db ok"),
                Fixtures.info(2, "10:00:01", "db", "api ok")
        )).isEmpty());
    }

    @Test
    void differentlyCasedSpellingsAreOneService() {
        Assertions.assertTrue(correlator.candidates(List.of(
                Fixtures.error(1, "10:00:00", "Auth-Service", "token store unavailable"),
                Fixtures.error(2, "10:00:02", "auth-service", "retrying Auth-Service token store")
        )).isEmpty());
    }
}

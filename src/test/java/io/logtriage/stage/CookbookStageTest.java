package io.logtriage.stage;

import io.logtriage.Fixtures;
import io.logtriage.model.Cookbook;
import io.logtriage.model.Remediation;
import io.logtriage.model.Severity;
import io.logtriage.state.Reducers;
import io.logtriage.state.SharedState;
import io.logtriage.state.StateUpdate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CookbookStageTest {
    @Test
    void rendersOneSectionPerRemediation() {
        SharedState state = Reducers.merge(SharedState.initial(List.of(), List.of()), StageId.REMEDIATE,
                StateUpdate.builder().remediations(List.of(
                        new Remediation("disk full", Severity.CRITICAL, 4, List.of("free space", "expand volume"), "volume at 99%"),
                        new Remediation("slow api", Severity.MEDIUM, 9, List.of("profile handler"), "")
                )).build());

        Cookbook cookbook = new CookbookStage().execute(Fixtures.context(StageId.COOKBOOK, state), null).cookbook();

        assertEquals(CookbookStage.TITLE, cookbook.title());
        assertEquals(2, cookbook.sections());
        assertTrue(cookbook.markdown().startsWith("# Incident Remediation Cookbook\n"));
        assertTrue(cookbook.markdown().contains("## 1. [CRITICAL] disk full"));
        assertTrue(cookbook.markdown().contains("2. expand volume"));
        assertTrue(cookbook.markdown().contains("> volume at 99%"));
        assertTrue(cookbook.markdown().contains("## 2. [MEDIUM] slow api"));
    }

    @Test
    void emptyRunStillProducesACookbook() {
        Cookbook cookbook = new CookbookStage().execute(
                Fixtures.context(StageId.COOKBOOK, List.of(), List.of()), null).cookbook();

        assertEquals(0, cookbook.sections());
        assertTrue(cookbook.markdown().contains("No remediations"));
    }
}

package io.logtriage.state;

import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.stage.StageId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-field merge functions. List fields append under the contributing stage, single-value
 * fields are written by their sole owner, and the progress marker is last-write-wins.
 */
public final class Reducers {
    private Reducers() {
    }

    public static SharedState merge(SharedState state, StageId stage, StateUpdate update) {
        if (state.isComplete(stage)) {
            throw new IllegalStateException("Stage already merged: " + stage.id());
        }
        StateUpdate safeUpdate = update == null ? StateUpdate.empty() : update;
        Set<StateField> foreign = safeUpdate.fieldsNotOwnedBy(stage);
        if (!foreign.isEmpty()) {
            return fail(state, stage, StageError.of(
                    stage,
                    StageErrorKind.OWNERSHIP_VIOLATION,
                    "stage " + stage.id() + " wrote fields it does not own: " + foreign
            ));
        }

        SharedState.Copy next = state.copy();
        if (safeUpdate.logSummary() != null) {
            next.logSummary = safeUpdate.logSummary();
        }
        appendTo(next.remediations, stage, safeUpdate.remediations());
        if (safeUpdate.cookbook() != null) {
            next.cookbook = safeUpdate.cookbook();
        }
        appendTo(next.tickets, stage, safeUpdate.tickets());
        appendTo(next.causalChains, stage, safeUpdate.causalChains());
        appendTo(next.riskPredictions, stage, safeUpdate.riskPredictions());
        if (safeUpdate.notification() != null) {
            next.notification = safeUpdate.notification();
        }
        appendTo(next.softErrors, stage, safeUpdate.softErrors());
        next.completedStages.add(stage);
        next.lastCompletedStage = stage;
        return next.build();
    }

    /**
     * Marks a stage complete with an empty contribution and records why.
     */
    public static SharedState fail(SharedState state, StageId stage, StageError error) {
        if (state.isComplete(stage)) {
            throw new IllegalStateException("Stage already merged: " + stage.id());
        }
        SharedState.Copy next = state.copy();
        appendTo(next.softErrors, stage, List.of(error));
        next.completedStages.add(stage);
        next.failedStages.add(stage);
        next.lastCompletedStage = stage;
        return next.build();
    }

    private static <T> void appendTo(Map<StageId, List<T>> field, StageId stage, List<T> values) {
        if (values == null) {
            return;
        }
        List<T> merged = new ArrayList<>(field.getOrDefault(stage, List.of()));
        merged.addAll(values);
        field.put(stage, merged);
    }
}

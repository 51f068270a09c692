package io.logtriage.stage;

import io.logtriage.reasoner.Reasoner;
import io.logtriage.state.StateUpdate;

/**
 * A unit of pipeline work. Implementations read the snapshot in the context and return a
 * proposed partial update; they never mutate shared state. Per-record problems belong in the
 * update's soft errors, an exception fails the whole stage.
 */
public interface Stage {
    StageId id();

    StateUpdate execute(StageContext context, Reasoner reasoner) throws Exception;
}

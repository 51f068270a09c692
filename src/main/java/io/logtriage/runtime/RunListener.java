package io.logtriage.runtime;

import io.logtriage.model.StageError;
import io.logtriage.stage.StageId;

/**
 * Callbacks from the scheduler thread. Implementations must not block for long; a listener that
 * throws is ignored for that event.
 */
public interface RunListener {
    default void runStarted(String runId, String traceId, int entryCount, int issueCount) {
    }

    default void stageStarted(String runId, String traceId, String spanId, StageId stage) {
    }

    default void stageCompleted(String runId, String traceId, String spanId, StageId stage, long durationMs) {
    }

    default void stageFailed(String runId, String traceId, String spanId, StageId stage, long durationMs, StageError error) {
    }

    default void runFinished(RunOutcome outcome) {
    }

    static RunListener noop() {
        return new RunListener() {
        };
    }
}

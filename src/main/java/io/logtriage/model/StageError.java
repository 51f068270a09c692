package io.logtriage.model;

import io.logtriage.stage.StageId;

/**
 * A recoverable, per-record or per-stage failure. {@code subject} names what was skipped (a
 * candidate cluster, a service, an issue) and is null for whole-stage failures.
 */
public record StageError(
        StageId stage,
        StageErrorKind kind,
        String message,
        String subject
) {
    public static StageError of(StageId stage, StageErrorKind kind, String message) {
        return new StageError(stage, kind, message, null);
    }

    public static StageError about(StageId stage, StageErrorKind kind, String subject, String message) {
        return new StageError(stage, kind, message, subject);
    }

    public boolean stageLevel() {
        return kind == StageErrorKind.STAGE_FAILED || kind == StageErrorKind.OWNERSHIP_VIOLATION;
    }
}

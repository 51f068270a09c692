package io.logtriage.model;

public enum StageErrorKind {
    STAGE_FAILED,
    REASONER_FAILED,
    MALFORMED_OUTPUT,
    UNPARSEABLE_TIMESTAMP,
    OWNERSHIP_VIOLATION
}

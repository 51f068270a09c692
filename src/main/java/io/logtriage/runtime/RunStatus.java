package io.logtriage.runtime;

public enum RunStatus {
    COMPLETED,
    CANCELLED
}

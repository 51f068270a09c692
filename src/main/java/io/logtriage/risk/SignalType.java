package io.logtriage.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
    BRUTE_FORCE("brute_force"),
    RETRY_ESCALATION("retry_escalation"),
    DISK_CRITICAL("disk_critical"),
    POOL_EXHAUSTION("pool_exhaustion"),
    FREQUENCY_ACCELERATION("frequency_acceleration"),
    NUMERIC_TREND("numeric_trend");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package io.logtriage.reasoner;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReasonerTask {
    CAUSAL_CHAIN("causal_chain"),
    RISK_ASSESSMENT("risk_assessment"),
    REMEDIATION("remediation"),
    NOTIFICATION_SUMMARY("notification_summary");

    private final String wireName;

    ReasonerTask(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

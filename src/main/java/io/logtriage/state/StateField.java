package io.logtriage.state;

import io.logtriage.stage.StageId;

/**
 * Analytical fields of {@link SharedState}, each written by exactly one stage.
 */
public enum StateField {
    LOG_SUMMARY(StageId.CLASSIFY),
    REMEDIATIONS(StageId.REMEDIATE),
    COOKBOOK(StageId.COOKBOOK),
    TICKETS(StageId.TICKET),
    CAUSAL_CHAINS(StageId.ROOT_CAUSE),
    RISK_PREDICTIONS(StageId.PREDICTIVE_RISK),
    NOTIFICATION(StageId.NOTIFY);

    private final StageId owner;

    StateField(StageId owner) {
        this.owner = owner;
    }

    public StageId owner() {
        return owner;
    }
}

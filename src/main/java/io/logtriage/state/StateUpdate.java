package io.logtriage.state;

import io.logtriage.model.CausalChain;
import io.logtriage.model.Cookbook;
import io.logtriage.model.LogSummary;
import io.logtriage.model.Notification;
import io.logtriage.model.Remediation;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.StageError;
import io.logtriage.model.TicketDraft;
import io.logtriage.stage.StageId;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Partial update proposed by one stage. Unset fields are null and leave shared state untouched.
 */
public final class StateUpdate {
    private final LogSummary logSummary;
    private final List<Remediation> remediations;
    private final Cookbook cookbook;
    private final List<TicketDraft> tickets;
    private final List<CausalChain> causalChains;
    private final List<RiskPrediction> riskPredictions;
    private final Notification notification;
    private final List<StageError> softErrors;

    private StateUpdate(Builder builder) {
        this.logSummary = builder.logSummary;
        this.remediations = builder.remediations == null ? null : List.copyOf(builder.remediations);
        this.cookbook = builder.cookbook;
        this.tickets = builder.tickets == null ? null : List.copyOf(builder.tickets);
        this.causalChains = builder.causalChains == null ? null : List.copyOf(builder.causalChains);
        this.riskPredictions = builder.riskPredictions == null ? null : List.copyOf(builder.riskPredictions);
        this.notification = builder.notification;
        this.softErrors = List.copyOf(builder.softErrors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateUpdate empty() {
        return new Builder().build();
    }

    public LogSummary logSummary() {
        return logSummary;
    }

    public List<Remediation> remediations() {
        return remediations;
    }

    public Cookbook cookbook() {
        return cookbook;
    }

    public List<TicketDraft> tickets() {
        return tickets;
    }

    public List<CausalChain> causalChains() {
        return causalChains;
    }

    public List<RiskPrediction> riskPredictions() {
        return riskPredictions;
    }

    public Notification notification() {
        return notification;
    }

    public List<StageError> softErrors() {
        return softErrors;
    }

    public Set<StateField> fields() {
        Set<StateField> fields = EnumSet.noneOf(StateField.class);
        if (logSummary != null) fields.add(StateField.LOG_SUMMARY);
        if (remediations != null) fields.add(StateField.REMEDIATIONS);
        if (cookbook != null) fields.add(StateField.COOKBOOK);
        if (tickets != null) fields.add(StateField.TICKETS);
        if (causalChains != null) fields.add(StateField.CAUSAL_CHAINS);
        if (riskPredictions != null) fields.add(StateField.RISK_PREDICTIONS);
        if (notification != null) fields.add(StateField.NOTIFICATION);
        return fields;
    }

    public Set<StateField> fieldsNotOwnedBy(StageId stage) {
        Set<StateField> foreign = EnumSet.noneOf(StateField.class);
        for (StateField field : fields()) {
            if (field.owner() != stage) {
                foreign.add(field);
            }
        }
        return foreign;
    }

    public static final class Builder {
        private LogSummary logSummary;
        private List<Remediation> remediations;
        private Cookbook cookbook;
        private List<TicketDraft> tickets;
        private List<CausalChain> causalChains;
        private List<RiskPrediction> riskPredictions;
        private Notification notification;
        private final List<StageError> softErrors = new ArrayList<>();

        private Builder() {
        }

        public Builder logSummary(LogSummary value) {
            this.logSummary = value;
            return this;
        }

        public Builder remediations(List<Remediation> value) {
            this.remediations = value;
            return this;
        }

        public Builder cookbook(Cookbook value) {
            this.cookbook = value;
            return this;
        }

        public Builder tickets(List<TicketDraft> value) {
            this.tickets = value;
            return this;
        }

        public Builder causalChains(List<CausalChain> value) {
            this.causalChains = value;
            return this;
        }

        public Builder riskPredictions(List<RiskPrediction> value) {
            this.riskPredictions = value;
            return this;
        }

        public Builder notification(Notification value) {
            this.notification = value;
            return this;
        }

        public Builder softError(StageError error) {
            if (error != null) {
                softErrors.add(error);
            }
            return this;
        }

        public Builder softErrors(List<StageError> errors) {
            if (errors != null) {
                errors.forEach(this::softError);
            }
            return this;
        }

        public StateUpdate build() {
            return new StateUpdate(this);
        }
    }
}

package io.logtriage.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.logtriage.model.CausalChain;
import io.logtriage.model.Cookbook;
import io.logtriage.model.Issue;
import io.logtriage.model.LogEntry;
import io.logtriage.model.LogSummary;
import io.logtriage.model.Notification;
import io.logtriage.model.Remediation;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.StageError;
import io.logtriage.model.TicketDraft;
import io.logtriage.stage.StageId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of one pipeline run. New snapshots are produced only by {@link Reducers}.
 *
 * <p>List fields keep each stage's contribution under its {@link StageId} and are exposed in
 * stage declaration order, so the result does not depend on the order siblings were merged in.
 */
@JsonPropertyOrder({
        "log_entries", "issues", "log_summary", "remediations", "cookbook", "tickets",
        "causal_chains", "risk_predictions", "notification", "completed_stages", "failed_stages",
        "last_completed_stage", "soft_errors"
})
public final class SharedState {
    private final List<LogEntry> logEntries;
    private final List<Issue> issues;
    private final LogSummary logSummary;
    private final Map<StageId, List<Remediation>> remediations;
    private final Cookbook cookbook;
    private final Map<StageId, List<TicketDraft>> tickets;
    private final Map<StageId, List<CausalChain>> causalChains;
    private final Map<StageId, List<RiskPrediction>> riskPredictions;
    private final Notification notification;
    private final Set<StageId> completedStages;
    private final Set<StageId> failedStages;
    private final StageId lastCompletedStage;
    private final Map<StageId, List<StageError>> softErrors;

    private SharedState(Copy copy) {
        this.logEntries = copy.logEntries;
        this.issues = copy.issues;
        this.logSummary = copy.logSummary;
        this.remediations = frozen(copy.remediations);
        this.cookbook = copy.cookbook;
        this.tickets = frozen(copy.tickets);
        this.causalChains = frozen(copy.causalChains);
        this.riskPredictions = frozen(copy.riskPredictions);
        this.notification = copy.notification;
        this.completedStages = Collections.unmodifiableSet(EnumSet.copyOf(copy.completedStages));
        this.failedStages = Collections.unmodifiableSet(EnumSet.copyOf(copy.failedStages));
        this.lastCompletedStage = copy.lastCompletedStage;
        this.softErrors = frozen(copy.softErrors);
    }

    public static SharedState initial(List<LogEntry> logEntries, List<Issue> issues) {
        Copy copy = new Copy();
        copy.logEntries = logEntries == null ? List.of() : List.copyOf(logEntries);
        copy.issues = issues == null ? List.of() : List.copyOf(issues);
        return new SharedState(copy);
    }

    @JsonProperty("log_entries")
    public List<LogEntry> logEntries() {
        return logEntries;
    }

    @JsonProperty("issues")
    public List<Issue> issues() {
        return issues;
    }

    @JsonProperty("log_summary")
    public LogSummary logSummary() {
        return logSummary;
    }

    @JsonProperty("remediations")
    public List<Remediation> remediations() {
        return flatten(remediations);
    }

    @JsonProperty("cookbook")
    public Cookbook cookbook() {
        return cookbook;
    }

    @JsonProperty("tickets")
    public List<TicketDraft> tickets() {
        return flatten(tickets);
    }

    @JsonProperty("causal_chains")
    public List<CausalChain> causalChains() {
        return flatten(causalChains);
    }

    @JsonProperty("risk_predictions")
    public List<RiskPrediction> riskPredictions() {
        return flatten(riskPredictions);
    }

    @JsonProperty("notification")
    public Notification notification() {
        return notification;
    }

    @JsonProperty("completed_stages")
    public Set<StageId> completedStages() {
        return completedStages;
    }

    @JsonProperty("failed_stages")
    public Set<StageId> failedStages() {
        return failedStages;
    }

    @JsonProperty("last_completed_stage")
    public StageId lastCompletedStage() {
        return lastCompletedStage;
    }

    @JsonProperty("soft_errors")
    public List<StageError> softErrors() {
        return flatten(softErrors);
    }

    public boolean isComplete(StageId stage) {
        return completedStages.contains(stage);
    }

    Copy copy() {
        Copy copy = new Copy();
        copy.logEntries = logEntries;
        copy.issues = issues;
        copy.logSummary = logSummary;
        copy.remediations.putAll(remediations);
        copy.cookbook = cookbook;
        copy.tickets.putAll(tickets);
        copy.causalChains.putAll(causalChains);
        copy.riskPredictions.putAll(riskPredictions);
        copy.notification = notification;
        copy.completedStages.addAll(completedStages);
        copy.failedStages.addAll(failedStages);
        copy.lastCompletedStage = lastCompletedStage;
        copy.softErrors.putAll(softErrors);
        return copy;
    }

    private static <T> Map<StageId, List<T>> frozen(Map<StageId, List<T>> source) {
        Map<StageId, List<T>> out = new EnumMap<>(StageId.class);
        source.forEach((stage, values) -> out.put(stage, List.copyOf(values)));
        return Collections.unmodifiableMap(out);
    }

    private static <T> List<T> flatten(Map<StageId, List<T>> byStage) {
        if (byStage.isEmpty()) {
            return List.of();
        }
        List<T> out = new ArrayList<>();
        for (List<T> values : byStage.values()) {
            out.addAll(values);
        }
        return Collections.unmodifiableList(out);
    }

    static final class Copy {
        List<LogEntry> logEntries = List.of();
        List<Issue> issues = List.of();
        LogSummary logSummary;
        final Map<StageId, List<Remediation>> remediations = new EnumMap<>(StageId.class);
        Cookbook cookbook;
        final Map<StageId, List<TicketDraft>> tickets = new EnumMap<>(StageId.class);
        final Map<StageId, List<CausalChain>> causalChains = new EnumMap<>(StageId.class);
        final Map<StageId, List<RiskPrediction>> riskPredictions = new EnumMap<>(StageId.class);
        Notification notification;
        final Set<StageId> completedStages = EnumSet.noneOf(StageId.class);
        final Set<StageId> failedStages = EnumSet.noneOf(StageId.class);
        StageId lastCompletedStage;
        final Map<StageId, List<StageError>> softErrors = new EnumMap<>(StageId.class);

        SharedState build() {
            return new SharedState(this);
        }
    }
}

package io.logtriage.stage;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.model.Issue;
import io.logtriage.model.Notification;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.Severity;
import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.reasoner.ReasonerRequest;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.state.StateUpdate;
import io.logtriage.util.Jsons;

import java.util.List;

/**
 * Prepares the outbound incident notification. Delivery is not performed here; the payload is
 * always a dry run.
 */
public final class NotifyStage implements Stage {
    public static final String NOTHING_TO_REPORT = "No actionable issues detected.";
    static final int MAX_LISTED_ISSUES = 5;

    private final String channel;

    public NotifyStage(String channel) {
        this.channel = channel == null || channel.isBlank() ? "#incidents" : channel.trim();
    }

    @Override
    public StageId id() {
        return StageId.NOTIFY;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<Issue> issues = context.state().issues();
        List<RiskPrediction> highRisks = context.highRiskPredictions();
        StateUpdate.Builder update = StateUpdate.builder();
        if (issues.isEmpty() && highRisks.isEmpty()) {
            return update.notification(notification(NOTHING_TO_REPORT, 0, highRisks)).build();
        }

        ObjectNode prompt = Jsons.mapper().createObjectNode();
        prompt.put("channel", channel);
        ArrayNode issueNodes = prompt.putArray("issues");
        issues.stream().sorted(RemediateStage.MOST_SEVERE_FIRST).forEach(issue -> {
            ObjectNode node = issueNodes.addObject();
            node.put("description", issue.description());
            node.put("severity", issue.severity().name());
            node.put("line_number", issue.lineNumber());
        });
        prompt.set("high_risks", Jsons.mapper().valueToTree(highRisks));

        ReasonerResult result = Reasoner.call(reasoner,
                new ReasonerRequest(ReasonerTask.NOTIFICATION_SUMMARY, SensitiveDataMasker.masked(prompt)));
        String summary = result.success() ? result.output().path("summary").asText("").trim() : "";
        if (!result.success()) {
            update.softError(StageError.about(id(), StageErrorKind.REASONER_FAILED, channel, result.error()));
            summary = fallbackSummary(issues, highRisks);
        } else if (summary.isEmpty()) {
            update.softError(StageError.about(id(), StageErrorKind.MALFORMED_OUTPUT, channel, "missing summary"));
            summary = fallbackSummary(issues, highRisks);
        }
        return update.notification(notification(summary, issues.size(), highRisks)).build();
    }

    static String fallbackSummary(List<Issue> issues, List<RiskPrediction> highRisks) {
        Severity top = issues.stream().map(Issue::severity).max(Enum::compareTo).orElse(Severity.LOW);
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(top).append("] ").append(issues.size()).append(" issue(s) detected");
        issues.stream().sorted(RemediateStage.MOST_SEVERE_FIRST).limit(MAX_LISTED_ISSUES).forEach(issue ->
                sb.append("\n- ").append(issue.severity()).append(": ").append(issue.description()));
        if (!highRisks.isEmpty()) {
            sb.append("\nRisk forecast:");
            for (RiskPrediction risk : highRisks) {
                sb.append("\n- ").append(risk.service()).append(": ").append(risk.preventiveAction());
            }
        }
        return sb.toString();
    }

    private Notification notification(String summary, int issueCount, List<RiskPrediction> highRisks) {
        return new Notification(channel, summary, issueCount, highRisks, false, Notification.DRY_RUN);
    }
}

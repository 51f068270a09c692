package io.logtriage.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.model.Issue;
import io.logtriage.model.Remediation;
import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.reasoner.ReasonerRequest;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.state.StateUpdate;
import io.logtriage.util.Jsons;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class RemediateStage implements Stage {
    static final Comparator<Issue> MOST_SEVERE_FIRST = Comparator
            .comparing(Issue::severity, Comparator.reverseOrder())
            .thenComparingInt(Issue::lineNumber);

    private final int issueLimit;

    public RemediateStage(int issueLimit) {
        this.issueLimit = Math.max(0, issueLimit);
    }

    @Override
    public StageId id() {
        return StageId.REMEDIATE;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<Issue> selected = context.state().issues().stream()
                .sorted(MOST_SEVERE_FIRST)
                .limit(issueLimit)
                .toList();
        List<Remediation> remediations = new ArrayList<>();
        StateUpdate.Builder update = StateUpdate.builder();
        for (Issue issue : selected) {
            String subject = "issue at line " + issue.lineNumber();
            ObjectNode prompt = Jsons.mapper().createObjectNode();
            prompt.put("issue", issue.description());
            prompt.put("severity", issue.severity().name());
            prompt.put("line_number", issue.lineNumber());
            ReasonerResult result = Reasoner.call(reasoner,
                    new ReasonerRequest(ReasonerTask.REMEDIATION, SensitiveDataMasker.masked(prompt)));
            if (!result.success()) {
                update.softError(StageError.about(id(), StageErrorKind.REASONER_FAILED, subject, result.error()));
                continue;
            }
            JsonNode steps = result.output().path("steps");
            if (!steps.isArray() || steps.isEmpty()) {
                update.softError(StageError.about(id(), StageErrorKind.MALFORMED_OUTPUT, subject, "missing steps"));
                continue;
            }
            List<String> stepTexts = new ArrayList<>();
            steps.forEach(step -> {
                String text = step.asText("").trim();
                if (!text.isEmpty()) {
                    stepTexts.add(text);
                }
            });
            if (stepTexts.isEmpty()) {
                update.softError(StageError.about(id(), StageErrorKind.MALFORMED_OUTPUT, subject, "steps are blank"));
                continue;
            }
            remediations.add(new Remediation(issue.description(), issue.severity(), issue.lineNumber(),
                    stepTexts, result.output().path("rationale").asText("")));
        }
        return update.remediations(remediations).build();
    }
}

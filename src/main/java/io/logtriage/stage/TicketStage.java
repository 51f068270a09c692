package io.logtriage.stage;

import io.logtriage.model.Issue;
import io.logtriage.model.Remediation;
import io.logtriage.model.TicketDraft;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.state.StateUpdate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drafts one ticket per HIGH or CRITICAL issue, attaching remediation steps when they exist.
 */
public final class TicketStage implements Stage {
    private static final int TITLE_LIMIT = 80;

    @Override
    public StageId id() {
        return StageId.TICKET;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<TicketDraft> tickets = new ArrayList<>();
        List<Issue> issues = context.state().issues().stream()
                .filter(i -> i.severity().isHighOrWorse())
                .sorted(RemediateStage.MOST_SEVERE_FIRST)
                .toList();
        for (Issue issue : issues) {
            Optional<Remediation> remediation = context.state().remediations().stream()
                    .filter(r -> r.lineNumber() == issue.lineNumber() && r.issue().equals(issue.description()))
                    .findFirst();
            StringBuilder body = new StringBuilder();
            body.append("*Severity:* ").append(issue.severity()).append('\n');
            body.append("*Line:* ").append(issue.lineNumber()).append('\n');
            body.append("*Description:* ").append(issue.description()).append("\n\n");
            if (remediation.isPresent()) {
                body.append("*Remediation steps:*\n");
                int step = 0;
                for (String text : remediation.get().steps()) {
                    body.append(++step).append(". ").append(text).append('\n');
                }
            } else {
                body.append("_No remediation steps available._\n");
            }
            tickets.add(new TicketDraft(
                    "[" + issue.severity() + "] " + shorten(issue.description()),
                    issue.severity(),
                    body.toString().stripTrailing(),
                    List.of("incident", issue.severity().name().toLowerCase(Locale.ROOT))
            ));
        }
        return StateUpdate.builder().tickets(tickets).build();
    }

    private static String shorten(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.length() <= TITLE_LIMIT ? trimmed : trimmed.substring(0, TITLE_LIMIT - 3) + "...";
    }
}

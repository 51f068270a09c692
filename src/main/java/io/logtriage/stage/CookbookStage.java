package io.logtriage.stage;

import io.logtriage.model.Cookbook;
import io.logtriage.model.Remediation;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.state.StateUpdate;

import java.util.List;

/**
 * Renders merged remediations as a markdown runbook.
 */
public final class CookbookStage implements Stage {
    static final String TITLE = "Incident Remediation Cookbook";

    @Override
    public StageId id() {
        return StageId.COOKBOOK;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<Remediation> remediations = context.state().remediations();
        StringBuilder md = new StringBuilder();
        md.append("# ").append(TITLE).append("\n\n");
        if (remediations.isEmpty()) {
            md.append("_No remediations were produced for this run._\n");
        }
        int section = 0;
        for (Remediation remediation : remediations) {
            section++;
            md.append("## ").append(section).append(". [").append(remediation.severity()).append("] ")
                    .append(remediation.issue()).append("\n\n");
            md.append("Reported at line ").append(remediation.lineNumber()).append(".\n\n");
            int step = 0;
            for (String text : remediation.steps()) {
                md.append(++step).append(". ").append(text).append('\n');
            }
            if (!remediation.rationale().isBlank()) {
                md.append("\n> ").append(remediation.rationale()).append('\n');
            }
            md.append('\n');
        }
        Cookbook cookbook = new Cookbook(TITLE, md.toString().stripTrailing() + "\n", section);
        return StateUpdate.builder().cookbook(cookbook).build();
    }
}

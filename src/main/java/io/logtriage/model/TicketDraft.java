package io.logtriage.model;

import java.util.List;

public record TicketDraft(
        String title,
        Severity severity,
        String body,
        List<String> labels
) {
    public TicketDraft {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}

package io.logtriage.risk;

import io.logtriage.model.LogEntry;

import java.util.List;

/**
 * One fired detector for one service, with the entries that made it fire.
 */
public record EscalationSignal(
        String service,
        SignalType type,
        String detail,
        List<LogEntry> entries
) {
    public EscalationSignal {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("signal " + type + " for " + service + " has no supporting entries");
        }
        entries = List.copyOf(entries);
    }

    public List<String> references() {
        return entries.stream().map(LogEntry::reference).toList();
    }
}

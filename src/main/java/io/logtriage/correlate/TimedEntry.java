package io.logtriage.correlate;

import io.logtriage.model.LogEntry;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * A log entry paired with its parsed timestamp.
 */
public record TimedEntry(LocalDateTime at, LogEntry entry) {
    public static final Comparator<TimedEntry> CHRONOLOGICAL = Comparator
            .comparing(TimedEntry::at)
            .thenComparingInt(t -> t.entry().lineNumber());
}

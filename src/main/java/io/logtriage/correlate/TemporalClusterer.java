package io.logtriage.correlate;

import io.logtriage.model.LogEntry;
import io.logtriage.model.LogTimestamps;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Partitions warning-or-worse entries into the connected components of the "within window"
 * relation. On a sorted timeline that is a split wherever two consecutive entries are further
 * apart than the window.
 */
public final class TemporalClusterer {
    private final Duration window;

    public TemporalClusterer(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("correlation window must be non-negative");
        }
        this.window = window;
    }

    public Result cluster(List<LogEntry> entries) {
        List<TimedEntry> timed = new ArrayList<>();
        List<LogEntry> unparseable = new ArrayList<>();
        for (LogEntry entry : entries) {
            if (!entry.level().isWarningOrWorse()) {
                continue;
            }
            Optional<LocalDateTime> at = LogTimestamps.parse(entry.timestamp());
            if (at.isPresent()) {
                timed.add(new TimedEntry(at.get(), entry));
            } else {
                unparseable.add(entry);
            }
        }
        timed.sort(TimedEntry.CHRONOLOGICAL);

        List<List<TimedEntry>> clusters = new ArrayList<>();
        List<TimedEntry> current = new ArrayList<>();
        for (TimedEntry entry : timed) {
            if (!current.isEmpty()) {
                TimedEntry previous = current.get(current.size() - 1);
                if (Duration.between(previous.at(), entry.at()).compareTo(window) > 0) {
                    clusters.add(List.copyOf(current));
                    current = new ArrayList<>();
                }
            }
            current.add(entry);
        }
        if (!current.isEmpty()) {
            clusters.add(List.copyOf(current));
        }
        return new Result(List.copyOf(clusters), List.copyOf(unparseable));
    }

    public record Result(List<List<TimedEntry>> clusters, List<LogEntry> unparseable) {
    }
}

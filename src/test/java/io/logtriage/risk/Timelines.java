package io.logtriage.risk;

import io.logtriage.correlate.TimedEntry;
import io.logtriage.model.LogEntry;
import io.logtriage.model.LogTimestamps;

import java.util.Arrays;
import java.util.List;

final class Timelines {
    private Timelines() {
    }

    static List<TimedEntry> of(LogEntry... entries) {
        return Arrays.stream(entries)
                .map(e -> new TimedEntry(LogTimestamps.parse(e.timestamp()).orElseThrow(), e))
                .sorted(TimedEntry.CHRONOLOGICAL)
                .toList();
    }
}

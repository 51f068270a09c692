package io.logtriage.stage;

import io.logtriage.model.LogEntry;
import io.logtriage.model.LogLevel;
import io.logtriage.model.LogSummary;
import io.logtriage.model.LogTimestamps;
import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.state.StateUpdate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Counts entries per level and service and records which timestamps could not be read. Does not
 * call the reasoner.
 */
public final class ClassifyStage implements Stage {
    @Override
    public StageId id() {
        return StageId.CLASSIFY;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<LogEntry> entries = context.state().logEntries();
        Map<LogLevel, Integer> byLevel = new EnumMap<>(LogLevel.class);
        Map<String, Integer> byService = new LinkedHashMap<>();
        TreeSet<String> known = new TreeSet<>();
        LocalDateTime first = null;
        LocalDateTime last = null;
        List<StageError> errors = new ArrayList<>();

        for (LogEntry entry : entries) {
            byLevel.merge(entry.level(), 1, Integer::sum);
            byService.merge(entry.service(), 1, Integer::sum);
            if (!entry.service().isBlank() && !"unknown".equalsIgnoreCase(entry.service())) {
                known.add(entry.service());
            }
            Optional<LocalDateTime> at = LogTimestamps.parse(entry.timestamp());
            if (at.isEmpty()) {
                errors.add(StageError.about(id(), StageErrorKind.UNPARSEABLE_TIMESTAMP,
                        "line " + entry.lineNumber(), "unreadable timestamp: " + entry.timestamp()));
                continue;
            }
            if (first == null || at.get().isBefore(first)) {
                first = at.get();
            }
            if (last == null || at.get().isAfter(last)) {
                last = at.get();
            }
        }

        LogSummary summary = new LogSummary(
                entries.size(),
                byLevel,
                byService,
                new ArrayList<>(known),
                first == null ? null : LogTimestamps.format(first),
                last == null ? null : LogTimestamps.format(last),
                errors.size()
        );
        return StateUpdate.builder().logSummary(summary).softErrors(errors).build();
    }
}

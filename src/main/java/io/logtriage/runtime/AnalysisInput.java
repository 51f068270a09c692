package io.logtriage.runtime;

import io.logtriage.model.Issue;
import io.logtriage.model.LogEntry;
import io.logtriage.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed entries and pre-detected issues, as produced by the upstream parser.
 */
public record AnalysisInput(List<LogEntry> entries, List<Issue> issues) {
    public AnalysisInput {
        entries = entries == null ? List.of() : numbered(entries);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static AnalysisInput read(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Input file not found: " + file);
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), AnalysisInput.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid input file: " + file + ": " + e.getMessage(), e);
        }
    }

    // Entries without a line number take their 1-based position.
    private static List<LogEntry> numbered(List<LogEntry> entries) {
        List<LogEntry> out = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            LogEntry e = entries.get(i);
            if (e == null) {
                continue;
            }
            out.add(e.lineNumber() > 0 ? e : new LogEntry(e.timestamp(), e.level(), e.service(), e.message(), i + 1));
        }
        return List.copyOf(out);
    }
}

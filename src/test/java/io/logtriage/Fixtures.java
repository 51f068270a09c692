package io.logtriage;

import io.logtriage.model.Issue;
import io.logtriage.model.LogEntry;
import io.logtriage.model.LogLevel;
import io.logtriage.model.Severity;
import io.logtriage.stage.StageContext;
import io.logtriage.stage.StageId;
import io.logtriage.state.SharedState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

public final class Fixtures {
    private Fixtures() {
    }

    public static LogEntry entry(int line, String timestamp, LogLevel level, String service, String message) {
        return new LogEntry(timestamp, level, service, message, line);
    }

    public static LogEntry warn(int line, String time, String service, String message) {
        return entry(line, "2024-03-01 " + time, LogLevel.WARN, service, message);
    }

    public static LogEntry error(int line, String time, String service, String message) {
        return entry(line, "2024-03-01 " + time, LogLevel.ERROR, service, message);
    }

    public static LogEntry critical(int line, String time, String service, String message) {
        return entry(line, "2024-03-01 " + time, LogLevel.CRITICAL, service, message);
    }

    public static LogEntry info(int line, String time, String service, String message) {
        return entry(line, "2024-03-01 " + time, LogLevel.INFO, service, message);
    }

    public static Issue issue(String description, Severity severity, int line) {
        return new Issue(description, severity, line);
    }

    /**
     * Three authentication failures in eight seconds followed by a payment outage that blames
     * the auth service.
     */
    public static List<LogEntry> authPaymentIncident() {
        return List.of(
                error(1, "10:00:00", "auth-service", "authentication failed for user alice"),
                error(2, "10:00:05", "auth-service", "authentication failed for user alice"),
                error(3, "10:00:08", "auth-service", "authentication failed for user alice"),
                critical(4, "10:00:12", "payment-service", "payment rejected: token check via auth-service timed out")
        );
    }

    public static List<Issue> authPaymentIssues() {
        return List.of(
                issue("Repeated authentication failures for alice", Severity.HIGH, 1),
                issue("Payment rejected after auth-service timeout", Severity.CRITICAL, 4)
        );
    }

    public static StageContext context(StageId stage, SharedState state) {
        return new StageContext("run-test", stage, "0af7651916cd43dd8448eb211c80319c", "b7ad6b7169203331", state);
    }

    public static StageContext context(StageId stage, List<LogEntry> entries, List<Issue> issues) {
        return context(stage, SharedState.initial(entries, issues));
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

package io.logtriage.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LogTriageConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "logtriage-settings.json";

    private final Path rootDir;

    public LogTriageConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LogTriageConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LogTriageConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path traceRoot() {
        return rootDir.resolve("trace");
    }

    public Path traceFile() {
        return traceRoot().resolve("otel-spans.jsonl");
    }
}

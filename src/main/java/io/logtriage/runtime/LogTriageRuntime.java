package io.logtriage.runtime;

import io.logtriage.config.LogTriageConfig;
import io.logtriage.config.PipelineSettings;
import io.logtriage.observability.AuditLogger;
import io.logtriage.observability.AuditRunListener;
import io.logtriage.observability.AuditVerifier;
import io.logtriage.observability.OtelTraceExporter;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.stage.StageRegistry;
import io.logtriage.state.SharedState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;

/**
 * Wires configuration, the stage registry, the standard graph and run auditing together.
 */
public final class LogTriageRuntime {
    private final LogTriageConfig config;
    private final PipelineSettings settings;
    private final PipelineGraph graph;
    private final StageRegistry registry;
    private final String auditSigningSecret;
    private final AuditLogger auditLogger;

    public LogTriageRuntime(LogTriageConfig config) {
        this(config, PipelineSettings.load(config));
    }

    public LogTriageRuntime(LogTriageConfig config, PipelineSettings settings) {
        this(config, settings, StageRegistry.standard(settings));
    }

    public LogTriageRuntime(LogTriageConfig config, PipelineSettings settings, StageRegistry registry) {
        this.config = config;
        this.settings = settings;
        this.graph = PipelineGraph.standard();
        this.registry = registry;
        this.auditSigningSecret = loadOrCreateAuditSigningSecret(config.auditSigningKeyFile());
        this.auditLogger = new AuditLogger(
                config.auditLogFile(),
                auditSigningSecret,
                new OtelTraceExporter(config.traceFile(), "logtriage")
        );
    }

    public LogTriageConfig config() {
        return config;
    }

    public PipelineSettings settings() {
        return settings;
    }

    public PipelineGraph graph() {
        return graph;
    }

    public RunOutcome analyze(AnalysisInput input, Reasoner reasoner) {
        return analyze(input, reasoner, new RunCancellation());
    }

    public RunOutcome analyze(AnalysisInput input, Reasoner reasoner, RunCancellation cancellation) {
        GraphScheduler scheduler = new GraphScheduler(
                graph,
                registry,
                settings.maxParallelStages(),
                settings.runTimeoutMs(),
                new AuditRunListener(auditLogger)
        );
        return scheduler.run(SharedState.initial(input.entries(), input.issues()), reasoner, cancellation);
    }

    public AuditVerifier.AuditIntegrityOutcome verifyAudit(int limit) {
        AuditVerifier.AuditIntegrityOutcome out = AuditVerifier.verify(config.auditLogFile(), auditSigningSecret, limit);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "audit.verify",
                out.ok() ? "ok" : "failed",
                null,
                null,
                null,
                null,
                Map.of(
                        "checked_rows", out.checkedRows(),
                        "broken_line", out.brokenLine(),
                        "reason", out.reason()
                )
        ));
        return out;
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }
}

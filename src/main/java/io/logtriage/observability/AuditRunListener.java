package io.logtriage.observability;

import io.logtriage.model.StageError;
import io.logtriage.runtime.RunListener;
import io.logtriage.runtime.RunOutcome;
import io.logtriage.stage.StageId;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes scheduler callbacks to the audit log. Stage and run rows carry their start time so the
 * mirrored spans have a real duration.
 */
public final class AuditRunListener implements RunListener {
    private final AuditLogger auditLogger;
    private final Map<String, Instant> startedAt = new ConcurrentHashMap<>();

    public AuditRunListener(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public void runStarted(String runId, String traceId, int entryCount, int issueCount) {
        startedAt.put(runId, Instant.now());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entries", entryCount);
        details.put("issues", issueCount);
        auditLogger.log(AuditLogger.AuditEvent.of("run.started", "ok", runId, null, traceId, null, details));
    }

    @Override
    public void stageStarted(String runId, String traceId, String spanId, StageId stage) {
        startedAt.put(spanId, Instant.now());
    }

    @Override
    public void stageCompleted(String runId, String traceId, String spanId, StageId stage, long durationMs) {
        auditLogger.log(AuditLogger.AuditEvent.timed("stage.completed", "ok", runId, stage.id(), traceId, spanId,
                startedAt.remove(spanId), Instant.now(), Map.of("duration_ms", durationMs)));
    }

    @Override
    public void stageFailed(String runId, String traceId, String spanId, StageId stage, long durationMs, StageError error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duration_ms", durationMs);
        if (error != null) {
            details.put("kind", error.kind().name());
            details.put("message", error.message());
        }
        auditLogger.log(AuditLogger.AuditEvent.timed("stage.failed", "failed", runId, stage.id(), traceId, spanId,
                startedAt.remove(spanId), Instant.now(), details));
    }

    @Override
    public void runFinished(RunOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", outcome.status().name());
        details.put("duration_ms", outcome.durationMs());
        details.put("causal_chains", outcome.finalState().causalChains().size());
        details.put("risk_predictions", outcome.finalState().riskPredictions().size());
        details.put("soft_errors", outcome.errors().size());
        details.put("failed_stages", outcome.finalState().failedStages().size());
        if (outcome.cancelReason() != null) {
            details.put("cancel_reason", outcome.cancelReason());
        }
        auditLogger.log(AuditLogger.AuditEvent.timed("run.finished", outcome.completed() ? "ok" : "cancelled",
                outcome.runId(), null, outcome.traceId(), null,
                startedAt.remove(outcome.runId()), Instant.now(), details));
    }
}

package io.logtriage.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.util.Hashing;
import io.logtriage.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSONL log of run events. Every row carries the hash of the previous row, so any
 * edit or deletion breaks the chain; see {@link AuditVerifier}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private final OtelTraceExporter otelTraceExporter;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret, OtelTraceExporter otelTraceExporter) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.otelTraceExporter = otelTraceExporter;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = event.endedAt() == null ? Instant.now() : event.endedAt();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("result", event.result());
        row.put("run_id", event.runId());
        row.put("stage", event.stage());
        row.put("trace_id", event.traceId());
        row.put("span_id", event.spanId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
        if (otelTraceExporter != null) {
            otelTraceExporter.export(event, now);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    private String loadLastHash() {
        String last = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            // A torn last row starts a fresh chain; audit-verify reports the break.
            System.err.println("WARN audit log tail is not valid JSON, starting a new chain: " + e.getMessage());
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String result,
            String runId,
            String stage,
            String traceId,
            String spanId,
            Instant startedAt,
            Instant endedAt,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String result,
                String runId,
                String stage,
                String traceId,
                String spanId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, result, runId, stage, traceId, spanId, null, null,
                    details == null ? Map.of() : details);
        }

        /**
         * An event that covers a time range, exported as a span with real start and end times.
         */
        public static AuditEvent timed(
                String action,
                String result,
                String runId,
                String stage,
                String traceId,
                String spanId,
                Instant startedAt,
                Instant endedAt,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, result, runId, stage, traceId, spanId, startedAt, endedAt,
                    details == null ? Map.of() : details);
        }
    }
}

package io.logtriage.observability;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Locale;

/**
 * Mirrors audit events as OTLP/JSON spans, one {@code resourceSpans} document per line.
 */
public final class OtelTraceExporter {
    private static final String SCOPE = "logtriage-pipeline";

    private final Path outputFile;
    private final String serviceName;

    public OtelTraceExporter(Path outputFile, String serviceName) {
        this.outputFile = outputFile;
        this.serviceName = serviceName == null || serviceName.isBlank() ? "logtriage" : serviceName.trim();
        try {
            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            if (!Files.exists(outputFile)) {
                Files.createFile(outputFile);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize OTel exporter output: " + outputFile, e);
        }
    }

    public synchronized void export(AuditLogger.AuditEvent event, Instant timestamp) {
        if (event == null) {
            return;
        }
        Instant end = event.endedAt() == null ? timestamp : event.endedAt();
        Instant begin = event.startedAt() == null ? end : event.startedAt();
        String traceId = normalizeTraceId(event.traceId(), event.runId());
        String spanId = normalizeSpanId(event.spanId(), event.action(), end);

        ObjectNode root = Jsons.mapper().createObjectNode();
        ObjectNode resourceSpan = root.putArray("resourceSpans").addObject();
        ArrayNode attrs = resourceSpan.putObject("resource").putArray("attributes");
        appendStringAttr(attrs, "service.name", serviceName);

        ObjectNode scopeSpan = resourceSpan.putArray("scopeSpans").addObject();
        ObjectNode scope = scopeSpan.putObject("scope");
        scope.put("name", SCOPE);
        scope.put("version", "v1");
        ObjectNode span = scopeSpan.putArray("spans").addObject();
        span.put("traceId", traceId);
        span.put("spanId", spanId);
        span.put("name", event.action() == null ? "pipeline.event" : event.action());
        span.put("kind", 1);
        span.put("startTimeUnixNano", Long.toString(toUnixNanos(begin)));
        span.put("endTimeUnixNano", Long.toString(toUnixNanos(end)));
        span.put("status", event.result() == null || "ok".equalsIgnoreCase(event.result()) ? 1 : 2);
        ArrayNode spanAttrs = span.putArray("attributes");
        appendStringAttr(spanAttrs, "logtriage.run_id", event.runId());
        appendStringAttr(spanAttrs, "logtriage.stage", event.stage());
        appendStringAttr(spanAttrs, "logtriage.result", event.result());

        String line = Jsons.toCompactJson(root) + System.lineSeparator();
        try {
            Files.writeString(outputFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write OTel span export", e);
        }
    }

    private static long toUnixNanos(Instant instant) {
        return Math.max(0L, instant.getEpochSecond()) * 1_000_000_000L + instant.getNano();
    }

    private static void appendStringAttr(ArrayNode attrs, String key, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        ObjectNode item = attrs.addObject();
        item.put("key", key);
        item.putObject("value").put("stringValue", value);
    }

    static String normalizeTraceId(String raw, String fallbackSeed) {
        if (raw != null) {
            String trimmed = raw.trim().toLowerCase(Locale.ROOT);
            if (trimmed.matches("^[0-9a-f]{32}$")) {
                return trimmed;
            }
        }
        String seed = (raw == null ? "" : raw) + "|" + (fallbackSeed == null ? "" : fallbackSeed);
        return String.format("%032x", Integer.toUnsignedLong(seed.hashCode()));
    }

    static String normalizeSpanId(String raw, String action, Instant timestamp) {
        if (raw != null) {
            String trimmed = raw.trim().toLowerCase(Locale.ROOT);
            if (trimmed.matches("^[0-9a-f]{16}$")) {
                return trimmed;
            }
        }
        String src = (action == null ? "" : action) + "|" + timestamp.toEpochMilli();
        return String.format("%016x", Integer.toUnsignedLong(src.hashCode()));
    }
}

package io.logtriage.observability;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.util.Hashing;
import io.logtriage.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays the audit hash chain and reports the first row that does not match.
 */
public final class AuditVerifier {
    private AuditVerifier() {
    }

    public static AuditIntegrityOutcome verify(Path auditFile, String signingSecret, int limit) {
        if (!Files.exists(auditFile)) {
            return new AuditIntegrityOutcome(true, 0, 0, 0, "", "");
        }
        String secret = signingSecret == null ? "" : signingSecret.trim();
        int safeLimit = Math.max(0, limit);
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity: " + auditFile, e);
        }
        int start = safeLimit > 0 && safeLimit < lines.size() ? lines.size() - safeLimit : 0;
        boolean first = true;
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            totalRows++;
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                brokenLine = i + 1;
                reason = "invalid_json";
                break;
            }
            String hash = parsed.path("hash").asText("");
            if (hash.isBlank()) {
                brokenLine = i + 1;
                reason = "missing_hash";
                break;
            }
            String prevHash = parsed.path("prev_hash").asText("");
            // With a limit the window starts mid-chain, so the first row's predecessor is unknown.
            boolean anchored = !first || start == 0;
            if (anchored && !prevHash.equals(expectedPrev)) {
                brokenLine = i + 1;
                reason = "prev_hash_mismatch";
                break;
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                brokenLine = i + 1;
                reason = "hash_mismatch";
                break;
            }
            String signature = parsed.path("signature").asText("");
            if (!signature.isBlank() && !secret.isBlank()
                    && !Hashing.hmacSha256Hex(secret, hash).equals(signature)) {
                brokenLine = i + 1;
                reason = "signature_mismatch";
                break;
            }
            checkedRows++;
            expectedPrev = hash;
            first = false;
        }
        return new AuditIntegrityOutcome(brokenLine == 0, totalRows, checkedRows, brokenLine, reason, expectedPrev);
    }

    public record AuditIntegrityOutcome(
            boolean ok,
            @JsonProperty("total_rows") int totalRows,
            @JsonProperty("checked_rows") int checkedRows,
            @JsonProperty("broken_line") int brokenLine,
            String reason,
            @JsonProperty("tail_hash") String tailHash
    ) {
    }
}

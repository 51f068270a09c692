package io.logtriage.observability;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * W3C-style identifiers for runs and stage spans.
 */
public final class TraceContextUtil {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContextUtil() {
    }

    public static String newRunId() {
        return "run-" + LocalDate.now(ZoneOffset.UTC).toString().replace("-", "") + "-" + randomHex(4);
    }

    public static String newTraceId() {
        return randomHex(16);
    }

    public static String newSpanId() {
        return randomHex(8);
    }

    public static String toTraceParent(String traceId, String spanId) {
        return "00-" + traceId + "-" + spanId + "-01";
    }

    static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

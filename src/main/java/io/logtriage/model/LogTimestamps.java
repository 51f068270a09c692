package io.logtriage.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Canonical log timestamp format: {@code yyyy-MM-dd HH:mm:ss}. The ISO {@code T} separator is
 * tolerated, nothing else is.
 */
public final class LogTimestamps {
    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private LogTimestamps() {
    }

    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace('T', ' ');
        try {
            return Optional.of(LocalDateTime.parse(normalized, CANONICAL));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDateTime value) {
        return value == null ? "" : CANONICAL.format(value);
    }
}

package io.logtriage.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed extraction patterns for numeric values in log messages. Each extractor returns empty when
 * the message does not carry the value.
 */
public final class SignalPatterns {
    // The gap between keyword and number never crosses another keyword.
    static final Pattern PERCENT = Pattern.compile(
            "(?i)\\b(disk|cpu|memory|mem)\\b((?:(?!\\b(?:disk|cpu|memory|mem)\\b)[^%\\n])*?)"
                    + "(\\d+(?:\\.\\d+)?)\\s*%(\\s+(?:free|remaining|available|left)\\b)?");
    private static final Pattern CAPACITY_WORD = Pattern.compile("(?i)\\b(?:free|remaining|available|left)\\b");
    static final Pattern LATENCY = Pattern.compile("(?i)(\\d+(?:\\.\\d+)?)\\s*ms\\b");
    static final Pattern RETRY = Pattern.compile("(?i)\\bretr(?:y|ying)\\s*(?:attempt\\s*)?#?\\s*(\\d+)");
    static final Pattern POOL_RATIO_CONNECTIONS = Pattern.compile(
            "(?i)(\\d+)\\s*/\\s*(\\d+)\\s*(?:active\\s+)?(?:connections?|conns?)\\b");
    static final Pattern POOL_RATIO_CONTEXT = Pattern.compile("(?i)\\bpool\\b[^\\n]*?(\\d+)\\s*/\\s*(\\d+)");
    static final Pattern FREE_AFTER = Pattern.compile(
            "(?i)(\\d+(?:\\.\\d+)?)\\s*(%|[kmgt]i?b)?\\s+(?:free|remaining|available|left)\\b");
    static final Pattern FREE_BEFORE = Pattern.compile(
            "(?i)\\b(?:free|remaining|available)\\s+(?:space|capacity|memory|disk)?\\s*[:=]?\\s*(\\d+(?:\\.\\d+)?)\\s*(%|[kmgt]i?b)?");
    static final Pattern AUTH_FAILURE = Pattern.compile(
            "(?i)(failed.*(?:auth|login|credential|password)|(?:auth|authentication|login)\\s+fail|"
                    + "invalid\\s+(?:password|credentials?)|brute\\s*force|account\\s+locked|failed\\s+attempts)");
    private static final Pattern DIGITS = Pattern.compile("\\d+(?:\\.\\d+)?");

    private SignalPatterns() {
    }

    public record Percent(TrendMetric metric, double value) {
    }

    public record Ratio(long used, long total) {
        public double value() {
            return total <= 0 ? 0.0 : (double) used / (double) total;
        }
    }

    /**
     * Every usage percentage in the message, in order. Readings of free or remaining capacity are
     * skipped; {@link #freeCapacity(String)} covers those.
     */
    public static List<Percent> percents(String message) {
        List<Percent> found = new ArrayList<>();
        Matcher m = PERCENT.matcher(message);
        while (m.find()) {
            if (m.group(4) != null || CAPACITY_WORD.matcher(m.group(2)).find()) {
                continue;
            }
            TrendMetric metric = switch (m.group(1).toLowerCase(Locale.ROOT)) {
                case "disk" -> TrendMetric.DISK_PERCENT;
                case "cpu" -> TrendMetric.CPU_PERCENT;
                default -> TrendMetric.MEMORY_PERCENT;
            };
            found.add(new Percent(metric, Double.parseDouble(m.group(3))));
        }
        return found;
    }

    public static OptionalDouble latencyMs(String message) {
        Matcher m = LATENCY.matcher(message);
        return m.find() ? OptionalDouble.of(Double.parseDouble(m.group(1))) : OptionalDouble.empty();
    }

    public static OptionalInt retryCount(String message) {
        Matcher m = RETRY.matcher(message);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public static Optional<Ratio> poolUsage(String message) {
        Matcher m = POOL_RATIO_CONNECTIONS.matcher(message);
        if (!m.find()) {
            m = POOL_RATIO_CONTEXT.matcher(message);
            if (!m.find()) {
                return Optional.empty();
            }
        }
        try {
            long used = Long.parseLong(m.group(1));
            long total = Long.parseLong(m.group(2));
            return total > 0 ? Optional.of(new Ratio(used, total)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Free capacity, with byte-size units normalized to megabytes. Percentages and unitless
     * values are returned as written.
     */
    public static OptionalDouble freeCapacity(String message) {
        Matcher m = FREE_AFTER.matcher(message);
        if (!m.find()) {
            m = FREE_BEFORE.matcher(message);
            if (!m.find()) {
                return OptionalDouble.empty();
            }
        }
        double value = Double.parseDouble(m.group(1));
        String unit = m.group(2);
        return OptionalDouble.of(value * megabytesPer(unit));
    }

    public static boolean isAuthFailure(String message) {
        return AUTH_FAILURE.matcher(message).find();
    }

    /**
     * Message with numbers blanked out, used to recognise retries of the same operation.
     */
    public static String operationKey(String message) {
        return DIGITS.matcher(message.toLowerCase(Locale.ROOT)).replaceAll("#").trim();
    }

    private static double megabytesPer(String unit) {
        if (unit == null || unit.equals("%")) {
            return 1.0;
        }
        return switch (Character.toLowerCase(unit.charAt(0))) {
            case 'k' -> 1.0 / 1024.0;
            case 'g' -> 1024.0;
            case 't' -> 1024.0 * 1024.0;
            default -> 1.0;
        };
    }
}

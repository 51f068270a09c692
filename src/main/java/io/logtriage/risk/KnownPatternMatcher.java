package io.logtriage.risk;

import io.logtriage.correlate.TimedEntry;
import io.logtriage.model.LogEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Matches exactly four escalation signatures: brute-force authentication failures, escalating
 * retries of one operation, critical disk usage and near-exhausted connection pools.
 */
public final class KnownPatternMatcher implements SignalDetector {
    private final int bruteForceThreshold;
    private final Duration window;
    private final double diskThresholdPercent;
    private final double poolThresholdRatio;
    private final int retryMinSamples;

    public KnownPatternMatcher(int bruteForceThreshold, Duration window, double diskThresholdPercent,
                               double poolThresholdRatio, int retryMinSamples) {
        this.bruteForceThreshold = Math.max(1, bruteForceThreshold);
        this.window = window;
        this.diskThresholdPercent = diskThresholdPercent;
        this.poolThresholdRatio = poolThresholdRatio;
        this.retryMinSamples = Math.max(2, retryMinSamples);
    }

    @Override
    public List<EscalationSignal> detect(String service, List<TimedEntry> timeline) {
        List<EscalationSignal> signals = new ArrayList<>();
        bruteForce(service, timeline).ifPresent(signals::add);
        signals.addAll(retryEscalation(service, timeline));
        diskCritical(service, timeline).ifPresent(signals::add);
        poolExhaustion(service, timeline).ifPresent(signals::add);
        return signals;
    }

    Optional<EscalationSignal> bruteForce(String service, List<TimedEntry> timeline) {
        List<TimedEntry> failures = timeline.stream()
                .filter(t -> SignalPatterns.isAuthFailure(t.entry().message()))
                .toList();
        // Sliding window over the chronological failures; the widest qualifying burst wins.
        List<TimedEntry> best = List.of();
        int start = 0;
        for (int end = 0; end < failures.size(); end++) {
            while (Duration.between(failures.get(start).at(), failures.get(end).at()).compareTo(window) > 0) {
                start++;
            }
            if (end - start + 1 > best.size()) {
                best = failures.subList(start, end + 1);
            }
        }
        if (best.size() < bruteForceThreshold) {
            return Optional.empty();
        }
        String detail = best.size() + " authentication failures within " + window.toSeconds() + "s";
        return Optional.of(new EscalationSignal(service, SignalType.BRUTE_FORCE, detail, entries(best)));
    }

    List<EscalationSignal> retryEscalation(String service, List<TimedEntry> timeline) {
        Map<String, List<TimedEntry>> byOperation = new LinkedHashMap<>();
        for (TimedEntry timed : timeline) {
            if (SignalPatterns.retryCount(timed.entry().message()).isPresent()) {
                byOperation.computeIfAbsent(SignalPatterns.operationKey(timed.entry().message()), k -> new ArrayList<>())
                        .add(timed);
            }
        }
        List<EscalationSignal> signals = new ArrayList<>();
        for (List<TimedEntry> attempts : byOperation.values()) {
            if (attempts.size() < retryMinSamples || !strictlyIncreasing(attempts)) {
                continue;
            }
            int first = SignalPatterns.retryCount(attempts.get(0).entry().message()).getAsInt();
            int last = SignalPatterns.retryCount(attempts.get(attempts.size() - 1).entry().message()).getAsInt();
            String detail = "retry count climbing " + first + " -> " + last + " for the same operation";
            signals.add(new EscalationSignal(service, SignalType.RETRY_ESCALATION, detail, entries(attempts)));
        }
        return signals;
    }

    Optional<EscalationSignal> diskCritical(String service, List<TimedEntry> timeline) {
        for (TimedEntry timed : timeline) {
            for (SignalPatterns.Percent percent : SignalPatterns.percents(timed.entry().message())) {
                if (percent.metric() == TrendMetric.DISK_PERCENT && percent.value() > diskThresholdPercent) {
                    String detail = String.format(Locale.ROOT, "disk usage at %.0f%% (threshold %.0f%%)",
                            percent.value(), diskThresholdPercent);
                    return Optional.of(new EscalationSignal(service, SignalType.DISK_CRITICAL, detail,
                            List.of(timed.entry())));
                }
            }
        }
        return Optional.empty();
    }

    Optional<EscalationSignal> poolExhaustion(String service, List<TimedEntry> timeline) {
        for (TimedEntry timed : timeline) {
            Optional<SignalPatterns.Ratio> usage = SignalPatterns.poolUsage(timed.entry().message());
            if (usage.isPresent() && usage.get().value() > poolThresholdRatio) {
                SignalPatterns.Ratio ratio = usage.get();
                String detail = String.format(Locale.ROOT, "pool at %d/%d (%.0f%%, threshold %.0f%%)",
                        ratio.used(), ratio.total(), ratio.value() * 100.0, poolThresholdRatio * 100.0);
                return Optional.of(new EscalationSignal(service, SignalType.POOL_EXHAUSTION, detail,
                        List.of(timed.entry())));
            }
        }
        return Optional.empty();
    }

    private static boolean strictlyIncreasing(List<TimedEntry> attempts) {
        int previous = Integer.MIN_VALUE;
        for (TimedEntry attempt : attempts) {
            OptionalInt count = SignalPatterns.retryCount(attempt.entry().message());
            if (count.isEmpty() || count.getAsInt() <= previous) {
                return false;
            }
            previous = count.getAsInt();
        }
        return true;
    }

    private static List<LogEntry> entries(List<TimedEntry> timed) {
        return timed.stream().map(TimedEntry::entry).toList();
    }
}

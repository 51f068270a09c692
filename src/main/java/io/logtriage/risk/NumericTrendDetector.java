package io.logtriage.risk;

import io.logtriage.correlate.TimedEntry;
import io.logtriage.model.LogEntry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Extracts metric samples per service and fires once per metric whose successive samples worsen
 * monotonically over at least {@code minSamples} values.
 */
public final class NumericTrendDetector implements SignalDetector {
    private final int minSamples;

    public NumericTrendDetector(int minSamples) {
        this.minSamples = Math.max(2, minSamples);
    }

    @Override
    public List<EscalationSignal> detect(String service, List<TimedEntry> timeline) {
        Map<TrendMetric, List<Sample>> series = new EnumMap<>(TrendMetric.class);
        for (TimedEntry timed : timeline) {
            LogEntry entry = timed.entry();
            String message = entry.message();
            for (SignalPatterns.Percent p : SignalPatterns.percents(message)) {
                add(series, p.metric(), p.value(), entry);
            }
            OptionalDouble latency = SignalPatterns.latencyMs(message);
            if (latency.isPresent()) {
                add(series, TrendMetric.LATENCY_MS, latency.getAsDouble(), entry);
            }
            OptionalInt retries = SignalPatterns.retryCount(message);
            if (retries.isPresent()) {
                add(series, TrendMetric.RETRY_COUNT, retries.getAsInt(), entry);
            }
            SignalPatterns.poolUsage(message)
                    .ifPresent(r -> add(series, TrendMetric.POOL_UTILIZATION, r.value(), entry));
            OptionalDouble free = SignalPatterns.freeCapacity(message);
            if (free.isPresent()) {
                add(series, TrendMetric.FREE_CAPACITY, free.getAsDouble(), entry);
            }
        }

        List<EscalationSignal> signals = new ArrayList<>();
        for (Map.Entry<TrendMetric, List<Sample>> e : series.entrySet()) {
            List<Sample> run = worseningRun(e.getKey(), e.getValue());
            if (run.isEmpty()) {
                continue;
            }
            String detail = String.format(Locale.ROOT, "%s: %s -> %s over %d samples",
                    e.getKey().metricName(), format(run.get(0).value()),
                    format(run.get(run.size() - 1).value()), run.size());
            signals.add(new EscalationSignal(service, SignalType.NUMERIC_TREND, detail,
                    run.stream().map(Sample::entry).toList()));
        }
        return signals;
    }

    /**
     * First maximal run of successive samples that never improves, is at least
     * {@code minSamples} long and ends strictly worse than it started. Empty when there is none.
     */
    List<Sample> worseningRun(TrendMetric metric, List<Sample> samples) {
        int start = 0;
        for (int i = 1; i <= samples.size(); i++) {
            boolean continues = i < samples.size() && !improves(metric, samples.get(i - 1).value(), samples.get(i).value());
            if (continues) {
                continue;
            }
            List<Sample> run = samples.subList(start, i);
            if (run.size() >= minSamples && worse(metric, run.get(0).value(), run.get(run.size() - 1).value())) {
                return List.copyOf(run);
            }
            start = i;
        }
        return List.of();
    }

    private static boolean improves(TrendMetric metric, double previous, double next) {
        return metric.lowerIsWorse() ? next > previous : next < previous;
    }

    private static boolean worse(TrendMetric metric, double first, double last) {
        return metric.lowerIsWorse() ? last < first : last > first;
    }

    private static void add(Map<TrendMetric, List<Sample>> series, TrendMetric metric, double value, LogEntry entry) {
        series.computeIfAbsent(metric, k -> new ArrayList<>()).add(new Sample(value, entry));
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    record Sample(double value, LogEntry entry) {
    }
}

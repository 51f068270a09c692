package io.logtriage.risk;

import io.logtriage.correlate.TimedEntry;
import io.logtriage.model.LogEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fires when a service's warnings arrive faster and faster: at least three gaps between
 * consecutive warnings, no gap more than the tolerance above the shortest gap before it, and the
 * last gap strictly shorter than the first.
 */
public final class FrequencyAccelerationDetector implements SignalDetector {
    static final int MIN_GAPS = 3;

    private final double toleranceSeconds;

    public FrequencyAccelerationDetector(double toleranceSeconds) {
        this.toleranceSeconds = Math.max(0.0, toleranceSeconds);
    }

    @Override
    public List<EscalationSignal> detect(String service, List<TimedEntry> timeline) {
        if (timeline.size() < MIN_GAPS + 1) {
            return List.of();
        }
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < timeline.size(); i++) {
            Duration gap = Duration.between(timeline.get(i - 1).at(), timeline.get(i).at());
            gaps.add(gap.toMillis() / 1000.0);
        }
        // Bounded by the shortest gap so far, not the previous one.
        double shortest = gaps.get(0);
        for (int i = 1; i < gaps.size(); i++) {
            if (gaps.get(i) > shortest + toleranceSeconds) {
                return List.of();
            }
            shortest = Math.min(shortest, gaps.get(i));
        }
        double first = gaps.get(0);
        double last = gaps.get(gaps.size() - 1);
        if (!(last < first)) {
            return List.of();
        }
        List<LogEntry> entries = timeline.stream().map(TimedEntry::entry).toList();
        String detail = String.format(Locale.ROOT, "%d warnings with gaps shrinking from %.0fs to %.0fs",
                timeline.size(), first, last);
        return List.of(new EscalationSignal(service, SignalType.FREQUENCY_ACCELERATION, detail, entries));
    }
}

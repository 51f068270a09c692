package io.logtriage.risk;

import io.logtriage.correlate.TimedEntry;

import java.util.List;

/**
 * Inspects one service's chronological warning timeline and reports the signals it finds.
 */
public interface SignalDetector {
    List<EscalationSignal> detect(String service, List<TimedEntry> timeline);
}

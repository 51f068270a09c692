package io.logtriage.risk;

import io.logtriage.config.PipelineSettings;
import io.logtriage.correlate.TimedEntry;
import io.logtriage.model.LogEntry;
import io.logtriage.model.LogTimestamps;
import io.logtriage.model.RiskPrediction;
import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.reasoner.ReasonerRequest;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.stage.Stage;
import io.logtriage.stage.StageContext;
import io.logtriage.stage.StageId;
import io.logtriage.state.StateUpdate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Predictive-risk stage. Runs the signal detectors over each service's warning timeline, bundles
 * the evidence per service and asks the reasoner for a forecast per bundle.
 */
public final class RiskDetector implements Stage {
    private final List<SignalDetector> detectors;

    public RiskDetector(PipelineSettings settings) {
        this(List.of(
                new FrequencyAccelerationDetector(settings.accelerationToleranceSeconds()),
                new NumericTrendDetector(settings.trendMinSamples()),
                new KnownPatternMatcher(
                        settings.bruteForceThreshold(),
                        Duration.ofSeconds(settings.correlationWindowSeconds()),
                        settings.diskThresholdPercent(),
                        settings.poolThresholdRatio(),
                        settings.retryMinSamples()
                )
        ));
    }

    public RiskDetector(List<SignalDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    @Override
    public StageId id() {
        return StageId.PREDICTIVE_RISK;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<EvidenceBundle> bundles = bundles(context.state().logEntries());
        List<RiskPrediction> predictions = new ArrayList<>();
        StateUpdate.Builder update = StateUpdate.builder();
        for (EvidenceBundle bundle : bundles) {
            ReasonerRequest request = new ReasonerRequest(
                    ReasonerTask.RISK_ASSESSMENT,
                    SensitiveDataMasker.masked(bundle.toContext())
            );
            ReasonerResult result = Reasoner.call(reasoner, request);
            if (!result.success()) {
                update.softError(StageError.about(id(), StageErrorKind.REASONER_FAILED, bundle.service(), result.error()));
                continue;
            }
            RiskResponseParser.Parsed parsed = RiskResponseParser.parse(result.output(), bundle);
            if (parsed.prediction() == null) {
                update.softError(StageError.about(id(), StageErrorKind.MALFORMED_OUTPUT, bundle.service(), parsed.error()));
            } else {
                predictions.add(parsed.prediction());
            }
        }
        return update.riskPredictions(predictions).build();
    }

    public List<EvidenceBundle> bundles(List<LogEntry> entries) {
        List<EscalationSignal> signals = new ArrayList<>();
        for (Map.Entry<String, List<TimedEntry>> e : timelines(entries).entrySet()) {
            for (SignalDetector detector : detectors) {
                signals.addAll(detector.detect(e.getKey(), e.getValue()));
            }
        }
        return EvidenceBundle.aggregate(signals);
    }

    /**
     * Warning-or-worse entries with a readable timestamp, grouped by service in order of first
     * appearance and sorted chronologically within each service.
     */
    static Map<String, List<TimedEntry>> timelines(List<LogEntry> entries) {
        Map<String, List<TimedEntry>> byService = new LinkedHashMap<>();
        for (LogEntry entry : entries) {
            if (!entry.level().isWarningOrWorse()) {
                continue;
            }
            Optional<LocalDateTime> at = LogTimestamps.parse(entry.timestamp());
            if (at.isEmpty()) {
                continue;
            }
            byService.computeIfAbsent(entry.service(), k -> new ArrayList<>()).add(new TimedEntry(at.get(), entry));
        }
        byService.values().forEach(list -> list.sort(TimedEntry.CHRONOLOGICAL));
        return byService;
    }
}

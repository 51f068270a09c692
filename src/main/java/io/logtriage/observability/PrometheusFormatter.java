package io.logtriage.observability;

import io.logtriage.model.StageError;
import io.logtriage.runtime.RunOutcome;
import io.logtriage.stage.StageId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders one run as Prometheus text exposition.
 */
public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(RunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        Map<String, Long> durations = new LinkedHashMap<>();
        for (Map.Entry<StageId, Long> e : outcome.stageDurationsMs().entrySet()) {
            durations.put(e.getKey().id(), e.getValue());
        }
        appendMapGauge(sb, "logtriage_stage_duration_ms", "Stage wall time in milliseconds", "stage", durations);

        Map<String, Long> errorsByKind = new LinkedHashMap<>();
        for (StageError error : outcome.errors()) {
            errorsByKind.merge(error.kind().name(), 1L, Long::sum);
        }
        appendMapGauge(sb, "logtriage_soft_errors_total", "Soft errors grouped by kind", "kind", errorsByKind);

        appendGauge(sb, "logtriage_run_duration_ms", "Run wall time in milliseconds", outcome.durationMs());
        appendGauge(sb, "logtriage_run_cancelled", "Run cancelled flag (1=cancelled,0=completed)",
                outcome.completed() ? 0 : 1);
        appendGauge(sb, "logtriage_log_entries_total", "Log entries analysed", outcome.finalState().logEntries().size());
        appendGauge(sb, "logtriage_issues_total", "Issues supplied with the input", outcome.finalState().issues().size());
        appendGauge(sb, "logtriage_causal_chains_total", "Causal chains produced", outcome.finalState().causalChains().size());
        appendGauge(sb, "logtriage_risk_predictions_total", "Risk predictions produced",
                outcome.finalState().riskPredictions().size());
        appendGauge(sb, "logtriage_failed_stages_total", "Stages that failed", outcome.finalState().failedStages().size());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

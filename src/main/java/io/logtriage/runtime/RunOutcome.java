package io.logtriage.runtime;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logtriage.model.StageError;
import io.logtriage.stage.StageId;
import io.logtriage.state.SharedState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single terminal value of a run.
 */
public record RunOutcome(
        @JsonProperty("run_id") String runId,
        @JsonProperty("trace_id") String traceId,
        RunStatus status,
        @JsonProperty("cancel_reason") String cancelReason,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("stage_durations_ms") Map<StageId, Long> stageDurationsMs,
        @JsonProperty("state") SharedState finalState
) {
    public RunOutcome {
        stageDurationsMs = stageDurationsMs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stageDurationsMs));
    }

    public List<StageError> errors() {
        return finalState.softErrors();
    }

    /**
     * True when some detection was attempted but did not fully succeed, as opposed to a clean run
     * that simply found nothing.
     */
    @JsonProperty("degraded")
    public boolean degraded() {
        return status == RunStatus.CANCELLED || !finalState.softErrors().isEmpty();
    }

    @JsonIgnore
    public boolean completed() {
        return status == RunStatus.COMPLETED;
    }
}

package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Notification payload prepared for an outbound channel. Delivery happens outside this project,
 * so {@code sent} is always false and {@code mode} is {@code dry-run}.
 */
public record Notification(
        String channel,
        String summary,
        @JsonProperty("issue_count") int issueCount,
        @JsonProperty("high_risks") List<RiskPrediction> highRisks,
        boolean sent,
        String mode
) {
    public static final String DRY_RUN = "dry-run";

    public Notification {
        highRisks = highRisks == null ? List.of() : List.copyOf(highRisks);
    }
}

package io.logtriage.reasoner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic, rule-based reasoner. Produces the same answer shapes a model-backed reasoner is
 * asked for, so the pipeline can run offline and reproducibly.
 */
public final class HeuristicReasoner implements Reasoner {
    private static final Map<String, String> PREVENTIVE_ACTIONS = Map.of(
            "brute_force", "Lock or rate-limit the offending account and source address, then review authentication logs.",
            "pool_exhaustion", "Raise the connection pool ceiling and look for leaked or long-held connections.",
            "disk_critical", "Free disk space or expand the volume before writes start failing.",
            "retry_escalation", "Check the downstream dependency being retried and enable a circuit breaker.",
            "frequency_acceleration", "Investigate the accelerating warnings before they turn into an outage.",
            "numeric_trend", "Track the rising metric and scale or tune the resource before it saturates."
    );
    private static final Map<String, String> PREDICTIONS = Map.of(
            "brute_force", "Repeated authentication failures suggest an account takeover attempt or a lockout cascade.",
            "pool_exhaustion", "Connection pool is close to capacity; new requests will soon block or time out.",
            "disk_critical", "Disk usage is past the critical threshold and will exhaust free space.",
            "retry_escalation", "Retries keep climbing for the same operation; retry budget will be exhausted.",
            "frequency_acceleration", "Warnings are arriving faster and faster; the service is trending toward failure.",
            "numeric_trend", "A monitored metric keeps rising and will breach its limit if the trend continues."
    );
    private static final List<String> HIGH_RISK_SIGNALS = List.of("brute_force", "pool_exhaustion", "disk_critical");

    @Override
    public ReasonerResult reason(ReasonerRequest request) {
        JsonNode context = request.context();
        return switch (request.task()) {
            case CAUSAL_CHAIN -> ReasonerResult.ok(causalChain(context));
            case RISK_ASSESSMENT -> ReasonerResult.ok(riskAssessment(context));
            case REMEDIATION -> ReasonerResult.ok(remediation(context));
            case NOTIFICATION_SUMMARY -> ReasonerResult.ok(notificationSummary(context));
        };
    }

    private ObjectNode causalChain(JsonNode context) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        List<JsonNode> events = new ArrayList<>();
        context.path("events").forEach(events::add);
        if (events.isEmpty()) {
            out.put("causal", false);
            return out;
        }

        Map<String, Integer> referencedBy = new LinkedHashMap<>();
        Map<String, JsonNode> firstEventByService = new LinkedHashMap<>();
        for (JsonNode event : events) {
            String service = event.path("service").asText("");
            firstEventByService.putIfAbsent(service, event);
            referencedBy.putIfAbsent(service, 0);
        }
        for (JsonNode event : events) {
            String service = event.path("service").asText("");
            String text = event.path("event").asText("").toLowerCase(Locale.ROOT);
            for (String other : firstEventByService.keySet()) {
                if (!other.equals(service) && !other.isBlank() && text.contains(other.toLowerCase(Locale.ROOT))) {
                    referencedBy.merge(other, 1, Integer::sum);
                }
            }
        }

        // Most referenced service wins; insertion order breaks ties toward the earliest one.
        String rootService = firstEventByService.keySet().iterator().next();
        int best = -1;
        for (Map.Entry<String, Integer> entry : referencedBy.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                rootService = entry.getKey();
            }
        }
        JsonNode rootEvent = firstEventByService.get(rootService);
        String confidence;
        if (best > 0 && rootEvent == events.get(0)) {
            confidence = "HIGH";
        } else if (best > 0) {
            confidence = "MEDIUM";
        } else {
            confidence = "LOW";
        }

        Set<String> downstream = new LinkedHashSet<>(firstEventByService.keySet());
        downstream.remove(rootService);
        out.put("causal", true);
        out.put("root_cause", rootService + ": " + rootEvent.path("event").asText(""));
        out.put("confidence", confidence);
        out.put("summary", downstream.isEmpty()
                ? "Failure in " + rootService + " starting at " + rootEvent.path("timestamp").asText("") + "."
                : "Failure in " + rootService + " starting at " + rootEvent.path("timestamp").asText("")
                + " propagated to " + String.join(", ", downstream) + ".");
        return out;
    }

    private ObjectNode riskAssessment(JsonNode context) {
        Set<String> types = new LinkedHashSet<>();
        context.path("signals").forEach(signal -> types.add(signal.path("type").asText("")));

        String level;
        if (types.stream().anyMatch(HIGH_RISK_SIGNALS::contains) || types.size() >= 2) {
            level = "HIGH";
        } else if (types.contains("frequency_acceleration") || types.contains("retry_escalation")) {
            level = "MEDIUM";
        } else {
            level = "LOW";
        }
        String dominant = types.stream()
                .filter(HIGH_RISK_SIGNALS::contains)
                .findFirst()
                .orElse(types.isEmpty() ? "numeric_trend" : types.iterator().next());

        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("risk_level", level);
        out.put("prediction", context.path("service").asText("service") + ": "
                + PREDICTIONS.getOrDefault(dominant, PREDICTIONS.get("numeric_trend")));
        out.put("preventive_action", PREVENTIVE_ACTIONS.getOrDefault(dominant, PREVENTIVE_ACTIONS.get("numeric_trend")));
        out.put("time_horizon", switch (level) {
            case "HIGH" -> "minutes";
            case "MEDIUM" -> "hours";
            default -> "eventual";
        });
        return out;
    }

    private ObjectNode remediation(JsonNode context) {
        String issue = context.path("issue").asText("").toLowerCase(Locale.ROOT);
        List<String> steps = new ArrayList<>();
        if (issue.contains("timeout") || issue.contains("timed out")) {
            steps.add("Check latency and health of the upstream dependency.");
            steps.add("Review client timeout and retry settings.");
        }
        if (issue.contains("pool") || issue.contains("connection")) {
            steps.add("Inspect connection pool usage and look for leaked connections.");
            steps.add("Raise the pool ceiling if sustained load requires it.");
        }
        if (issue.contains("disk")) {
            steps.add("Clean up logs and temporary files on the affected volume.");
            steps.add("Expand the volume or add retention limits.");
        }
        if (issue.contains("auth") || issue.contains("login") || issue.contains("credential")) {
            steps.add("Review failed login sources and block abusive addresses.");
            steps.add("Verify credentials and token expiry for service accounts.");
        }
        if (issue.contains("memory") || issue.contains("oom")) {
            steps.add("Capture a heap dump and check for leaks.");
            steps.add("Raise memory limits if the working set grew legitimately.");
        }
        if (steps.isEmpty()) {
            steps.add("Inspect the log lines around the reported entry.");
            steps.add("Restart the affected component if it is unhealthy.");
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        ArrayNode stepsNode = out.putArray("steps");
        steps.forEach(stepsNode::add);
        out.put("rationale", "Matched issue keywords against known remediation playbooks.");
        return out;
    }

    private ObjectNode notificationSummary(JsonNode context) {
        StringBuilder sb = new StringBuilder();
        JsonNode issues = context.path("issues");
        String top = "LOW";
        for (JsonNode issue : issues) {
            String severity = issue.path("severity").asText("LOW");
            if (rank(severity) > rank(top)) {
                top = severity;
            }
        }
        sb.append("*[").append(top).append("] ").append(issues.size()).append(" issue(s) detected*\n");
        int shown = 0;
        for (JsonNode issue : issues) {
            if (shown++ >= 5) {
                break;
            }
            sb.append("- ").append(issue.path("severity").asText("")).append(": ")
                    .append(issue.path("description").asText("")).append('\n');
        }
        JsonNode risks = context.path("high_risks");
        if (risks.size() > 0) {
            sb.append("\n*Risk Forecast*\n");
            for (JsonNode risk : risks) {
                sb.append("- ").append(risk.path("service").asText("")).append(": ")
                        .append(risk.path("preventive_action").asText("")).append('\n');
            }
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("summary", sb.toString().strip());
        return out;
    }

    private static int rank(String severity) {
        return switch (severity.toUpperCase(Locale.ROOT)) {
            case "CRITICAL" -> 3;
            case "HIGH" -> 2;
            case "MEDIUM" -> 1;
            default -> 0;
        };
    }
}

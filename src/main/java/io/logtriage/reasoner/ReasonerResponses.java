package io.logtriage.reasoner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.logtriage.util.Jsons;

import java.util.regex.Pattern;

public final class ReasonerResponses {
    private static final Pattern LEADING_FENCE = Pattern.compile("^```\\w*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");
    private static final int MAX_ERROR_CHARS = 200;

    private ReasonerResponses() {
    }

    public static ReasonerResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ReasonerResult.fail("reasoner returned empty output");
        }
        String text = stripFences(raw.strip());
        try {
            JsonNode node = Jsons.mapper().readTree(text);
            if (node == null || node.isMissingNode()) {
                return ReasonerResult.fail("reasoner returned empty output");
            }
            return ReasonerResult.ok(node);
        } catch (JsonProcessingException e) {
            return ReasonerResult.fail("reasoner returned invalid JSON: " + truncate(text));
        }
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String withoutLeading = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(withoutLeading).replaceFirst("");
    }

    static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}

package io.logtriage.stage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage identifiers in provenance order. Merged list fields are always exposed in this order,
 * regardless of which sibling finished first.
 */
public enum StageId {
    CLASSIFY("classify"),
    REMEDIATE("remediate"),
    COOKBOOK("cookbook"),
    TICKET("ticket"),
    ROOT_CAUSE("root_cause"),
    PREDICTIVE_RISK("predictive_risk"),
    NOTIFY("notify");

    private final String id;

    StageId(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static StageId fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Stage id cannot be empty");
        }
        for (StageId value : values()) {
            if (value.id.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + raw);
    }
}

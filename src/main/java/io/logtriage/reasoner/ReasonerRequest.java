package io.logtriage.reasoner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.util.Jsons;

public record ReasonerRequest(ReasonerTask task, JsonNode context) {
    public ReasonerRequest {
        if (task == null) {
            throw new IllegalArgumentException("reasoner task cannot be null");
        }
        context = context == null ? Jsons.mapper().createObjectNode() : context;
    }

    public ObjectNode toEnvelope() {
        ObjectNode envelope = Jsons.mapper().createObjectNode();
        envelope.put("task", task.wireName());
        envelope.set("context", context);
        return envelope;
    }
}

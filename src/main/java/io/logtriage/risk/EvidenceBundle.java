package io.logtriage.risk;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.model.LogEntry;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.util.Jsons;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All signals fired for one service, with the distinct supporting lines in line order.
 */
public record EvidenceBundle(String service, List<EscalationSignal> signals) {
    public EvidenceBundle {
        if (signals == null || signals.isEmpty()) {
            throw new IllegalArgumentException("evidence bundle for " + service + " has no signals");
        }
        signals = List.copyOf(signals);
    }

    /**
     * Groups signals per service, keeping the order services first appear in. Services without
     * signals never get a bundle.
     */
    public static List<EvidenceBundle> aggregate(List<EscalationSignal> signals) {
        Map<String, List<EscalationSignal>> byService = new LinkedHashMap<>();
        for (EscalationSignal signal : signals) {
            byService.computeIfAbsent(signal.service(), k -> new ArrayList<>()).add(signal);
        }
        List<EvidenceBundle> bundles = new ArrayList<>();
        byService.forEach((service, list) -> bundles.add(new EvidenceBundle(service, list)));
        return bundles;
    }

    public Set<SignalType> types() {
        Set<SignalType> types = new LinkedHashSet<>();
        signals.forEach(s -> types.add(s.type()));
        return types;
    }

    public List<String> references() {
        Set<LogEntry> entries = new LinkedHashSet<>();
        signals.forEach(s -> entries.addAll(s.entries()));
        return entries.stream()
                .sorted(Comparator.comparingInt(LogEntry::lineNumber))
                .map(LogEntry::reference)
                .toList();
    }

    public ObjectNode toContext() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("service", service);
        ArrayNode list = root.putArray("signals");
        for (EscalationSignal signal : signals) {
            ObjectNode node = list.addObject();
            node.put("type", signal.type().wireName());
            node.put("detail", signal.detail());
            ArrayNode refs = node.putArray("references");
            signal.references().forEach(r -> refs.add(SensitiveDataMasker.maskInline(r)));
        }
        return root;
    }
}

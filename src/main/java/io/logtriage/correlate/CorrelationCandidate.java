package io.logtriage.correlate;

import io.logtriage.model.ChainEvent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A temporally clustered group of entries eligible for chain synthesis. {@code adjacent} is false
 * only when the cluster was kept under {@link AdjacencyPolicy#SURFACE_LOW_CONFIDENCE}.
 */
public record CorrelationCandidate(List<TimedEntry> events, boolean adjacent) {
    public CorrelationCandidate {
        events = List.copyOf(events);
    }

    public Set<String> services() {
        Set<String> services = new LinkedHashSet<>();
        for (TimedEntry event : events) {
            services.add(event.entry().service());
        }
        return services;
    }

    public List<ChainEvent> chainEvents() {
        return events.stream().map(t -> ChainEvent.of(t.entry())).toList();
    }

    public String label() {
        TimedEntry first = events.get(0);
        TimedEntry last = events.get(events.size() - 1);
        return "cluster lines " + first.entry().lineNumber() + "-" + last.entry().lineNumber()
                + " " + services();
    }
}

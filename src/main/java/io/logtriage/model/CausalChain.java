package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Directed cause/effect chain. {@link #affectedServices()} and {@link #blastRadius()} are derived
 * from the events and cannot be supplied independently.
 */
public record CausalChain(
        List<ChainEvent> chain,
        @JsonProperty("root_cause") String rootCause,
        Confidence confidence,
        String summary
) {
    public CausalChain {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("causal chain needs at least one event");
        }
        chain = List.copyOf(chain);
        rootCause = rootCause == null ? "" : rootCause;
        confidence = confidence == null ? Confidence.MEDIUM : confidence;
        summary = summary == null ? "" : summary;
    }

    @JsonProperty("affected_services")
    public Set<String> affectedServices() {
        Set<String> services = new LinkedHashSet<>();
        for (ChainEvent event : chain) {
            services.add(event.service());
        }
        return services;
    }

    @JsonProperty("blast_radius")
    public int blastRadius() {
        return affectedServices().size();
    }
}

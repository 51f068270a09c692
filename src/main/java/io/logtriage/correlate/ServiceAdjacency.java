package io.logtriage.correlate;

import io.logtriage.model.LogEntry;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Undirected service relation inferred from message text: two services are adjacent when one's
 * name appears in a message logged by the other.
 */
public final class ServiceAdjacency {
    static final String UNKNOWN_SERVICE = "unknown";

    private final Set<String> knownServices;
    private final Map<String, Set<String>> neighbours;

    private ServiceAdjacency(Set<String> knownServices, Map<String, Set<String>> neighbours) {
        this.knownServices = knownServices;
        this.neighbours = neighbours;
    }

    public static ServiceAdjacency scan(Collection<LogEntry> entries) {
        Set<String> known = new LinkedHashSet<>();
        for (LogEntry entry : entries) {
            if (!entry.service().isBlank() && !UNKNOWN_SERVICE.equals(entry.service())) {
                known.add(entry.service());
            }
        }
        Map<String, Set<String>> neighbours = new HashMap<>();
        for (LogEntry entry : entries) {
            String message = entry.message().toLowerCase(Locale.ROOT);
            for (String other : known) {
                if (other.equals(entry.service())) {
                    continue;
                }
                if (message.contains(other)) {
                    neighbours.computeIfAbsent(entry.service(), k -> new HashSet<>()).add(other);
                    neighbours.computeIfAbsent(other, k -> new HashSet<>()).add(entry.service());
                }
            }
        }
        return new ServiceAdjacency(Collections.unmodifiableSet(known), neighbours);
    }

    public Set<String> knownServices() {
        return knownServices;
    }

    public boolean adjacent(String a, String b) {
        return neighbours.getOrDefault(a, Set.of()).contains(b);
    }

    /**
     * True when the services form one connected component using only edges between members of
     * the given set. A single service is trivially connected.
     */
    public boolean connected(Set<String> services) {
        if (services.isEmpty()) {
            return false;
        }
        String start = services.iterator().next();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : neighbours.getOrDefault(current, Set.of())) {
                if (services.contains(next) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen.size() == services.size();
    }
}

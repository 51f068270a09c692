package io.logtriage.runtime;

import io.logtriage.stage.StageId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static dependency graph of stages. Built once, validated on construction, immutable afterwards.
 */
public final class PipelineGraph {
    private final List<StageId> nodes;
    private final Map<StageId, Set<StageId>> dependencies;
    private final Map<StageId, Set<StageId>> dependents;
    private final StageId start;
    private final Set<StageId> terminals;

    private PipelineGraph(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.start = builder.start;
        this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(builder.terminals));
        validate(builder);

        Map<StageId, Set<StageId>> deps = new EnumMap<>(StageId.class);
        Map<StageId, Set<StageId>> rev = new EnumMap<>(StageId.class);
        for (StageId node : nodes) {
            deps.put(node, EnumSet.noneOf(StageId.class));
            rev.put(node, EnumSet.noneOf(StageId.class));
        }
        for (Edge edge : builder.edges) {
            deps.get(edge.node()).add(edge.dependsOn());
            rev.get(edge.dependsOn()).add(edge.node());
        }
        deps.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        rev.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(rev);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * classify, then remediate, then cookbook / ticket / root_cause / predictive_risk in parallel,
     * with notify waiting on predictive_risk.
     */
    public static PipelineGraph standard() {
        return builder()
                .node(StageId.CLASSIFY)
                .node(StageId.REMEDIATE)
                .node(StageId.COOKBOOK)
                .node(StageId.TICKET)
                .node(StageId.ROOT_CAUSE)
                .node(StageId.PREDICTIVE_RISK)
                .node(StageId.NOTIFY)
                .edge(StageId.REMEDIATE, StageId.CLASSIFY)
                .edge(StageId.COOKBOOK, StageId.REMEDIATE)
                .edge(StageId.TICKET, StageId.REMEDIATE)
                .edge(StageId.ROOT_CAUSE, StageId.REMEDIATE)
                .edge(StageId.PREDICTIVE_RISK, StageId.REMEDIATE)
                .edge(StageId.NOTIFY, StageId.PREDICTIVE_RISK)
                .start(StageId.CLASSIFY)
                .terminal(StageId.COOKBOOK)
                .terminal(StageId.TICKET)
                .terminal(StageId.ROOT_CAUSE)
                .terminal(StageId.NOTIFY)
                .build();
    }

    public List<StageId> nodes() {
        return nodes;
    }

    public Set<StageId> dependenciesOf(StageId node) {
        Set<StageId> deps = dependencies.get(node);
        if (deps == null) {
            throw new IllegalArgumentException("Unknown stage: " + node);
        }
        return deps;
    }

    public Set<StageId> dependentsOf(StageId node) {
        return dependents.getOrDefault(node, Set.of());
    }

    public StageId start() {
        return start;
    }

    public Set<StageId> terminals() {
        return terminals;
    }

    /**
     * Nodes grouped by fan-out level: level 0 is the start node, every other node sits one level
     * after its deepest dependency. Nodes within a level are in declaration order.
     */
    public List<List<StageId>> levels() {
        Map<StageId, Integer> depth = new EnumMap<>(StageId.class);
        for (StageId node : topologicalOrder()) {
            int level = 0;
            for (StageId dep : dependencies.get(node)) {
                level = Math.max(level, depth.get(dep) + 1);
            }
            depth.put(node, level);
        }
        int max = depth.values().stream().mapToInt(Integer::intValue).max().orElse(-1);
        List<List<StageId>> levels = new ArrayList<>();
        for (int i = 0; i <= max; i++) {
            List<StageId> level = new ArrayList<>();
            for (StageId node : nodes) {
                if (depth.get(node) == i) {
                    level.add(node);
                }
            }
            levels.add(List.copyOf(level));
        }
        return List.copyOf(levels);
    }

    /**
     * Kahn ordering, ties broken by declaration order.
     */
    public List<StageId> topologicalOrder() {
        Map<StageId, Integer> remaining = new EnumMap<>(StageId.class);
        for (StageId node : nodes) {
            remaining.put(node, dependencies.get(node).size());
        }
        List<StageId> order = new ArrayList<>();
        Set<StageId> emitted = EnumSet.noneOf(StageId.class);
        while (order.size() < nodes.size()) {
            for (StageId node : nodes) {
                if (!emitted.contains(node) && remaining.get(node) == 0) {
                    emitted.add(node);
                    order.add(node);
                    for (StageId next : dependents.get(node)) {
                        remaining.merge(next, -1, Integer::sum);
                    }
                    break;
                }
            }
        }
        return List.copyOf(order);
    }

    private static void validate(Builder builder) {
        if (builder.nodes.isEmpty()) {
            throw new GraphValidationException("Pipeline graph has no nodes");
        }
        Set<StageId> ids = EnumSet.noneOf(StageId.class);
        for (StageId node : builder.nodes) {
            if (node == null) {
                throw new GraphValidationException("Pipeline node cannot be null");
            }
            if (!ids.add(node)) {
                throw new GraphValidationException("Duplicate pipeline node: " + node.id());
            }
        }
        Map<StageId, List<StageId>> graph = new EnumMap<>(StageId.class);
        for (StageId node : ids) {
            graph.put(node, new ArrayList<>());
        }
        for (Edge edge : builder.edges) {
            if (!ids.contains(edge.node())) {
                throw new GraphValidationException("Edge names unknown node: " + edge.node().id());
            }
            if (!ids.contains(edge.dependsOn())) {
                throw new GraphValidationException("Unknown dependsOn node: " + edge.dependsOn().id());
            }
            graph.get(edge.node()).add(edge.dependsOn());
        }
        if (builder.start == null || !ids.contains(builder.start)) {
            throw new GraphValidationException("Start node is missing or unknown: " + builder.start);
        }
        if (!graph.get(builder.start).isEmpty()) {
            throw new GraphValidationException("Start node cannot have dependencies: " + builder.start.id());
        }

        Set<StageId> visiting = EnumSet.noneOf(StageId.class);
        Set<StageId> visited = EnumSet.noneOf(StageId.class);
        for (StageId node : ids) {
            dfsCycleCheck(node, graph, visiting, visited);
        }

        Map<StageId, Set<StageId>> dependents = new EnumMap<>(StageId.class);
        for (StageId node : ids) {
            dependents.put(node, EnumSet.noneOf(StageId.class));
        }
        graph.forEach((node, deps) -> deps.forEach(dep -> dependents.get(dep).add(node)));

        Set<StageId> reachable = EnumSet.of(builder.start);
        Deque<StageId> queue = new ArrayDeque<>(List.of(builder.start));
        while (!queue.isEmpty()) {
            for (StageId next : dependents.get(queue.poll())) {
                if (reachable.add(next)) {
                    queue.add(next);
                }
            }
        }
        for (StageId node : builder.nodes) {
            if (!reachable.contains(node)) {
                throw new GraphValidationException("Node is unreachable from start: " + node.id());
            }
        }

        for (StageId terminal : builder.terminals) {
            if (!ids.contains(terminal)) {
                throw new GraphValidationException("Unknown terminal node: " + terminal);
            }
            if (!dependents.get(terminal).isEmpty()) {
                throw new GraphValidationException("Terminal node has dependents: " + terminal.id());
            }
        }
        for (StageId node : builder.nodes) {
            if (dependents.get(node).isEmpty() && !builder.terminals.contains(node)) {
                throw new GraphValidationException("Sink node is not declared terminal: " + node.id());
            }
        }
    }

    private static void dfsCycleCheck(StageId id, Map<StageId, List<StageId>> graph,
                                      Set<StageId> visiting, Set<StageId> visited) {
        if (visited.contains(id)) return;
        if (!visiting.add(id)) {
            throw new GraphValidationException("Pipeline graph contains cycle at node: " + id.id());
        }
        for (StageId dep : graph.getOrDefault(id, List.of())) {
            dfsCycleCheck(dep, graph, visiting, visited);
        }
        visiting.remove(id);
        visited.add(id);
    }

    record Edge(StageId node, StageId dependsOn) {
    }

    public static final class Builder {
        private final List<StageId> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Set<StageId> terminals = new LinkedHashSet<>();
        private StageId start;

        private Builder() {
        }

        public Builder node(StageId node) {
            nodes.add(node);
            return this;
        }

        /**
         * Declares that {@code node} runs only after {@code dependsOn} has been merged.
         */
        public Builder edge(StageId node, StageId dependsOn) {
            if (node == null || dependsOn == null) {
                throw new GraphValidationException("Edge endpoints cannot be null");
            }
            edges.add(new Edge(node, dependsOn));
            return this;
        }

        public Builder start(StageId node) {
            this.start = node;
            return this;
        }

        public Builder terminal(StageId node) {
            terminals.add(node);
            return this;
        }

        public PipelineGraph build() {
            return new PipelineGraph(this);
        }
    }
}

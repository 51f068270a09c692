package io.logtriage.correlate;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.config.PipelineSettings;
import io.logtriage.model.CausalChain;
import io.logtriage.model.Issue;
import io.logtriage.model.LogEntry;
import io.logtriage.model.StageErrorKind;
import io.logtriage.model.StageError;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.reasoner.ReasonerRequest;
import io.logtriage.reasoner.ReasonerResult;
import io.logtriage.reasoner.ReasonerTask;
import io.logtriage.security.SensitiveDataMasker;
import io.logtriage.stage.Stage;
import io.logtriage.stage.StageContext;
import io.logtriage.stage.StageId;
import io.logtriage.state.StateUpdate;
import io.logtriage.util.Jsons;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root-cause stage. Finds temporally clustered, service-connected groups of warnings and asks the
 * reasoner to narrate each one as a causal chain. A failure on one candidate never prevents the
 * others from being evaluated.
 */
public final class CausalCorrelator implements Stage {
    private final TemporalClusterer clusterer;
    private final AdjacencyPolicy policy;
    private final int minClusterServices;

    public CausalCorrelator(PipelineSettings settings) {
        this.clusterer = new TemporalClusterer(Duration.ofSeconds(settings.correlationWindowSeconds()));
        this.policy = settings.adjacencyPolicy() == null ? AdjacencyPolicy.DROP : settings.adjacencyPolicy();
        this.minClusterServices = Math.max(1, settings.minClusterServices());
    }

    @Override
    public StageId id() {
        return StageId.ROOT_CAUSE;
    }

    @Override
    public StateUpdate execute(StageContext context, Reasoner reasoner) {
        List<LogEntry> entries = context.state().logEntries();
        ServiceAdjacency adjacency = ServiceAdjacency.scan(entries);
        List<CorrelationCandidate> candidates = candidates(clusterer.cluster(entries).clusters(), adjacency);

        Set<Integer> issueLines = new HashSet<>();
        for (Issue issue : context.state().issues()) {
            issueLines.add(issue.lineNumber());
        }

        List<CausalChain> chains = new ArrayList<>();
        StateUpdate.Builder update = StateUpdate.builder();
        for (CorrelationCandidate candidate : candidates) {
            ReasonerRequest request = new ReasonerRequest(
                    ReasonerTask.CAUSAL_CHAIN,
                    SensitiveDataMasker.masked(promptContext(candidate, adjacency, issueLines))
            );
            ReasonerResult result = Reasoner.call(reasoner, request);
            if (!result.success()) {
                update.softError(StageError.about(id(), StageErrorKind.REASONER_FAILED,
                        candidate.label(), result.error()));
                continue;
            }
            ChainResponseParser.Parsed parsed = ChainResponseParser.parse(result.output(), candidate);
            if (parsed.malformed()) {
                update.softError(StageError.about(id(), StageErrorKind.MALFORMED_OUTPUT,
                        candidate.label(), parsed.error()));
            } else if (parsed.chain() != null) {
                chains.add(parsed.chain());
            }
        }
        return update.causalChains(chains).build();
    }

    /**
     * Clusters that span enough distinct services and, unless the policy surfaces them anyway,
     * whose services are connected through inferred adjacency.
     */
    public List<CorrelationCandidate> candidates(List<LogEntry> entries) {
        return candidates(clusterer.cluster(entries).clusters(), ServiceAdjacency.scan(entries));
    }

    private List<CorrelationCandidate> candidates(List<List<TimedEntry>> clusters, ServiceAdjacency adjacency) {
        List<CorrelationCandidate> out = new ArrayList<>();
        for (List<TimedEntry> cluster : clusters) {
            CorrelationCandidate candidate = new CorrelationCandidate(cluster, true);
            Set<String> services = candidate.services();
            if (services.size() < minClusterServices) {
                continue;
            }
            if (adjacency.connected(services)) {
                out.add(candidate);
            } else if (policy == AdjacencyPolicy.SURFACE_LOW_CONFIDENCE) {
                out.add(new CorrelationCandidate(cluster, false));
            }
        }
        return out;
    }

    private static ObjectNode promptContext(CorrelationCandidate candidate, ServiceAdjacency adjacency,
                                            Set<Integer> issueLines) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ArrayNode events = root.putArray("events");
        for (TimedEntry timed : candidate.events()) {
            LogEntry entry = timed.entry();
            ObjectNode event = events.addObject();
            event.put("service", entry.service());
            event.put("event", SensitiveDataMasker.maskInline(entry.message()));
            event.put("level", entry.level().name());
            event.put("timestamp", entry.timestamp());
            event.put("line_number", entry.lineNumber());
            event.put("reported_issue", issueLines.contains(entry.lineNumber()));
        }
        ArrayNode known = root.putArray("known_services");
        for (String service : new TreeSet<>(adjacency.knownServices())) {
            known.add(service);
        }
        root.put("adjacent", candidate.adjacent());
        return root;
    }
}

package io.logtriage.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtriage.config.LogTriageConfig;
import io.logtriage.config.PipelineSettings;
import io.logtriage.correlate.AdjacencyPolicy;
import io.logtriage.observability.AuditVerifier;
import io.logtriage.observability.PrometheusFormatter;
import io.logtriage.reasoner.HeuristicReasoner;
import io.logtriage.reasoner.HttpReasoner;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.reasoner.ScriptReasoner;
import io.logtriage.runtime.AnalysisInput;
import io.logtriage.runtime.LogTriageRuntime;
import io.logtriage.runtime.PipelineGraph;
import io.logtriage.runtime.RunOutcome;
import io.logtriage.stage.StageId;
import io.logtriage.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
        name = "logtriage",
        mixinStandardHelpOptions = true,
        description = "Incident log triage pipeline",
        subcommands = {
                LogTriageCommand.AnalyzeCommand.class,
                LogTriageCommand.GraphCommand.class,
                LogTriageCommand.SettingsCommand.class,
                LogTriageCommand.AuditVerifyCommand.class
        }
)
public final class LogTriageCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_CANCELLED = 2;

    @Option(names = {"--root"}, description = "Data root directory (settings, audit log, traces)", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: analyze | graph | settings | audit-verify");
    }

    LogTriageConfig config() {
        return LogTriageConfig.fromRoot(root);
    }

    static Reasoner reasoner(String kind, List<String> command, String url, long timeoutMs) {
        String normalized = kind == null ? "heuristic" : kind.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "heuristic" -> new HeuristicReasoner();
            case "script" -> {
                if (command == null || command.isEmpty()) {
                    throw new IllegalArgumentException("--reasoner script requires --reasoner-command");
                }
                yield new ScriptReasoner(command, timeoutMs);
            }
            case "http" -> {
                if (url == null || url.isBlank()) {
                    throw new IllegalArgumentException("--reasoner http requires --reasoner-url");
                }
                yield new HttpReasoner(url, timeoutMs);
            }
            default -> throw new IllegalArgumentException("Unknown reasoner: " + kind + " (expected heuristic|script|http)");
        };
    }

    @Command(name = "analyze", description = "Run the triage pipeline over a parsed log file")
    static final class AnalyzeCommand implements Callable<Integer> {
        @ParentCommand
        LogTriageCommand parent;

        @Option(names = {"--input"}, required = true, description = "JSON file with entries and issues")
        String input;

        @Option(names = {"--reasoner"}, defaultValue = "heuristic", description = "heuristic | script | http")
        String reasoner;

        @Option(names = {"--reasoner-command"}, arity = "1..*", description = "Command line of a script reasoner")
        List<String> reasonerCommand;

        @Option(names = {"--reasoner-url"}, description = "Endpoint of an HTTP reasoner")
        String reasonerUrl;

        @Option(names = {"--adjacency-policy"}, description = "drop | surface_low_confidence (overrides settings)")
        String adjacencyPolicy;

        @Option(names = {"--out"}, description = "Write the run outcome JSON to this file instead of stdout")
        String out;

        @Option(names = {"--metrics"}, description = "Also print run metrics in Prometheus text format")
        boolean metrics;

        @Override
        public Integer call() {
            RunOutcome outcome;
            try {
                LogTriageConfig config = parent.config();
                PipelineSettings settings = PipelineSettings.load(config);
                if (adjacencyPolicy != null && !adjacencyPolicy.isBlank()) {
                    settings = settings.withAdjacencyPolicy(AdjacencyPolicy.fromString(adjacencyPolicy));
                }
                Reasoner selected = reasoner(reasoner, reasonerCommand, reasonerUrl, settings.reasonerTimeoutMs());
                AnalysisInput parsed = AnalysisInput.read(Paths.get(input));
                outcome = new LogTriageRuntime(config, settings).analyze(parsed, selected);
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
            String json = Jsons.toJson(outcome);
            if (out == null || out.isBlank()) {
                System.out.println(json);
            } else {
                Path file = Paths.get(out);
                try {
                    if (file.toAbsolutePath().getParent() != null) {
                        Files.createDirectories(file.toAbsolutePath().getParent());
                    }
                    Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new RuntimeException("Failed to write run outcome: " + file, e);
                }
                System.out.println("Wrote run " + outcome.runId() + " (" + outcome.status() + ") to " + file);
            }
            if (metrics) {
                System.out.print(PrometheusFormatter.format(outcome));
            }
            return outcome.completed() ? EXIT_OK : EXIT_CANCELLED;
        }
    }

    @Command(name = "graph", description = "Validate and print the pipeline graph")
    static final class GraphCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            PipelineGraph graph;
            try {
                graph = PipelineGraph.standard();
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("start", graph.start().id());
            ArrayNode terminals = root.putArray("terminals");
            graph.terminals().forEach(t -> terminals.add(t.id()));
            ObjectNode deps = root.putObject("depends_on");
            for (StageId node : graph.nodes()) {
                ArrayNode list = deps.putArray(node.id());
                graph.dependenciesOf(node).forEach(d -> list.add(d.id()));
            }
            ArrayNode levels = root.putArray("levels");
            for (List<StageId> level : graph.levels()) {
                ArrayNode row = levels.addArray();
                level.forEach(s -> row.add(s.id()));
            }
            System.out.println(Jsons.toJson(root));
            return EXIT_OK;
        }
    }

    @Command(name = "settings", description = "Print effective pipeline settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        LogTriageCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(PipelineSettings.load(parent.config())));
                return EXIT_OK;
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the run audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LogTriageCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Optional tail row limit; 0 verifies full log")
        int limit;

        @Override
        public Integer call() {
            LogTriageConfig config = parent.config();
            LogTriageRuntime runtime = new LogTriageRuntime(config, PipelineSettings.defaults());
            AuditVerifier.AuditIntegrityOutcome out = runtime.verifyAudit(limit);
            System.out.println(Jsons.toJson(out));
            return out.ok() ? EXIT_OK : 1;
        }
    }
}

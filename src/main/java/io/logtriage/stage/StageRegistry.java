package io.logtriage.stage;

import io.logtriage.config.PipelineSettings;
import io.logtriage.correlate.CausalCorrelator;
import io.logtriage.risk.RiskDetector;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class StageRegistry {
    private final Map<StageId, Stage> stages = new EnumMap<>(StageId.class);

    public static StageRegistry standard(PipelineSettings settings) {
        StageRegistry registry = new StageRegistry();
        registry.register(new ClassifyStage());
        registry.register(new RemediateStage(settings.remediationIssueLimit()));
        registry.register(new CookbookStage());
        registry.register(new TicketStage());
        registry.register(new CausalCorrelator(settings));
        registry.register(new RiskDetector(settings));
        registry.register(new NotifyStage(settings.notifyChannel()));
        return registry;
    }

    public StageRegistry register(Stage stage) {
        stages.put(stage.id(), stage);
        return this;
    }

    public Optional<Stage> findById(StageId stageId) {
        return Optional.ofNullable(stages.get(stageId));
    }

    public Collection<StageId> listStageIds() {
        return stages.keySet();
    }
}

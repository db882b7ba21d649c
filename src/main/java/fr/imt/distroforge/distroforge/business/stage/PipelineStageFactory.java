package fr.imt.distroforge.distroforge.business.stage;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the stage implementations, keyed by {@link StageType}.
 * Fails at startup if a stage has no implementation or more than one.
 */
@Service
public class PipelineStageFactory {

    private final Map<StageType, PipelineStage> registry = new EnumMap<>(StageType.class);

    public PipelineStageFactory(List<PipelineStage> stages) {
        for (PipelineStage stage : stages) {
            PipelineStage previous = registry.put(stage.type(), stage);
            if (previous != null) {
                throw new IllegalStateException("Duplicate implementation for stage " + stage.type().getStageName());
            }
        }
        for (StageType type : StageType.values()) {
            if (!registry.containsKey(type)) {
                throw new IllegalStateException("No implementation for stage " + type.getStageName());
            }
        }
    }

    public PipelineStage create(StageType type) {
        return registry.get(type);
    }

    /**
     * All stages in execution order.
     */
    public List<PipelineStage> pipeline() {
        return Arrays.stream(StageType.values())
                .map(registry::get)
                .toList();
    }
}

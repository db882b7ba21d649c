package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.support.FakeToolchain;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineStageFactoryTest {

    private final FakeToolchain toolchain = new FakeToolchain();

    @Test
    void ordersStagesByType() {
        List<PipelineStage> stages = new ArrayList<>(allStages());
        Collections.reverse(stages);

        PipelineStageFactory factory = new PipelineStageFactory(stages);

        List<StageType> order = factory.pipeline().stream().map(PipelineStage::type).toList();
        assertEquals(List.of(StageType.values()), order);
        assertInstanceOf(IsoGenerationStage.class, factory.create(StageType.ISO_GENERATION));
    }

    @Test
    void refusesIncompletePipeline() {
        List<PipelineStage> stages = new ArrayList<>(allStages());
        stages.removeIf(stage -> stage.type() == StageType.CONTAINER_IMAGE);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new PipelineStageFactory(stages));
        assertEquals("No implementation for stage container-image", e.getMessage());
    }

    @Test
    void refusesDuplicateStage() {
        List<PipelineStage> stages = new ArrayList<>(allStages());
        stages.add(new SystemConfigurationStage());

        assertThrows(IllegalStateException.class, () -> new PipelineStageFactory(stages));
    }

    private List<PipelineStage> allStages() {
        return List.of(
                new PackageResolutionStage(toolchain),
                new RootfsBootstrapStage(toolchain),
                new SystemConfigurationStage(),
                new DisplayConfigurationStage(),
                new IsoGenerationStage(toolchain),
                new ContainerImageStage(toolchain),
                new ArtifactFinalizationStage());
    }
}

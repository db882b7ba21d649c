package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.ContainerImage;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.ContainerImageBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

@Component
@RequiredArgsConstructor
public class ContainerImageStage implements PipelineStage {

    private final ContainerImageBuilder containerImageBuilder;

    @Override
    public StageType type() {
        return StageType.CONTAINER_IMAGE;
    }

    @Override
    public StageResult run(StageContext context) {
        context.log("Building container image");
        ToolResult<ContainerImage> result = containerImageBuilder.buildImage(context.requireRootfs(), context.getLogSink());
        if (!result.isSuccess()) {
            return StageResult.failure(result.error());
        }

        ContainerImage image = result.value();
        if (image.isPushed()) {
            context.stage(StagedArtifact.reference(ArtifactType.DOCKER_IMAGE_REF, image.imageName(), image.registryReference()));
            return StageResult.success("Container image pushed: " + image.registryReference());
        }
        if (image.archive() == null || !Files.isRegularFile(image.archive())) {
            return StageResult.failure("Container image " + image.imageName() + " was neither pushed nor archived");
        }
        context.stage(StagedArtifact.file(ArtifactType.DOCKER_IMAGE, image.archive()));
        return StageResult.success("Container image archived: " + image.archive().getFileName());
    }
}

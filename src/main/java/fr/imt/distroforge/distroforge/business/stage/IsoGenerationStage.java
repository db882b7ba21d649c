package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.ImageMasteringTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
public class IsoGenerationStage implements PipelineStage {

    private final ImageMasteringTool imageMasteringTool;

    @Override
    public StageType type() {
        return StageType.ISO_GENERATION;
    }

    @Override
    public StageResult run(StageContext context) {
        context.log("Mastering bootable image for " + context.getSpec().base().getValue());
        ToolResult<Path> result = imageMasteringTool.masterIso(context.requireRootfs(), context.getLogSink());
        if (!result.isSuccess()) {
            return StageResult.failure(result.error());
        }

        Path image = result.value();
        if (image == null || !Files.isRegularFile(image)) {
            return StageResult.failure("Image mastering reported " + image + " but no such file exists");
        }
        context.stage(StagedArtifact.file(ArtifactType.ISO, image));
        return StageResult.success("Bootable image produced: " + image.getFileName());
    }
}

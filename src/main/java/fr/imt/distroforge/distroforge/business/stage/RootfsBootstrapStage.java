package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.BootstrapConfig;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.FilesystemBootstrapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;

@Component
@RequiredArgsConstructor
public class RootfsBootstrapStage implements PipelineStage {

    private final FilesystemBootstrapper filesystemBootstrapper;

    @Override
    public StageType type() {
        return StageType.ROOTFS_BOOTSTRAP;
    }

    @Override
    public StageResult run(StageContext context) throws IOException {
        BuildSpecification spec = context.getSpec();
        BootstrapConfig config = new BootstrapConfig(
                context.getBuildId(),
                spec.base(),
                spec.architecture(),
                spec.kernel(),
                spec.init(),
                context.getWorkspace());

        context.log("Bootstrapping " + spec.base().getValue() + " root filesystem for " + spec.architecture().getValue());
        ToolResult<RootfsHandle> result = filesystemBootstrapper.bootstrap(
                context.requireResolvedPackages(), config, context.getLogSink());
        if (!result.isSuccess()) {
            return StageResult.failure(result.error());
        }

        RootfsHandle rootfs = result.value();
        Files.createDirectories(rootfs.overlayDir());
        context.setRootfs(rootfs);
        return StageResult.success("Root filesystem ready: " + rootfs.imageReference());
    }

    @Override
    public void release(StageContext context) {
        if (context.getRootfs() != null) {
            filesystemBootstrapper.release(context.getRootfs());
        }
    }
}

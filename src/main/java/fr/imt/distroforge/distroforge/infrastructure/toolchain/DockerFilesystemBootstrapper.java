package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import fr.imt.distroforge.distroforge.business.model.BootstrapConfig;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.port.FilesystemBootstrapper;
import fr.imt.distroforge.distroforge.business.utils.Constants;
import fr.imt.distroforge.distroforge.exception.ImageBuildException;
import fr.imt.distroforge.distroforge.infrastructure.docker.DockerImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Bootstraps the base root filesystem as a container image built from a generated Dockerfile.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DockerFilesystemBootstrapper implements FilesystemBootstrapper {

    private static final String DOCKERFILE = "Dockerfile";

    private final DockerImageService dockerImageService;
    private final RootfsDockerfileGenerator dockerfileGenerator;

    @Override
    public ToolResult<RootfsHandle> bootstrap(ResolvedPackages packages, BootstrapConfig config, BuildLogSink logSink) {
        String imageTag = Constants.IMAGE_PREFIX + "-rootfs-" + config.buildId() + ":latest";
        try {
            Path contextDir = Files.createDirectories(config.workspace().resolve("rootfs"));
            String dockerfile = dockerfileGenerator.generate(config.base(), packages.packages());
            Files.writeString(contextDir.resolve(DOCKERFILE), dockerfile);
            logSink.log("Generated rootfs Dockerfile:\n" + dockerfile);

            dockerImageService.buildImage(logSink, contextDir, DOCKERFILE, imageTag,
                    config.architecture().getDockerPlatform(),
                    Map.of(Constants.MANAGED_LABEL, "true", Constants.BUILD_LABEL, config.buildId()));

            return ToolResult.success(new RootfsHandle(
                    config.buildId(),
                    imageTag,
                    config.base(),
                    config.architecture(),
                    packages.packages(),
                    config.workspace()));
        } catch (IOException e) {
            log.error("Failed to prepare rootfs build context for {}", config.buildId(), e);
            return ToolResult.failure("Failed to prepare rootfs build context: " + e.getMessage());
        } catch (ImageBuildException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    @Override
    public void release(RootfsHandle rootfs) {
        log.info("Removing rootfs image {} of build {}", rootfs.imageReference(), rootfs.buildId());
        dockerImageService.removeImage(rootfs.imageReference());
    }
}

package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import fr.imt.distroforge.distroforge.business.model.ContainerImage;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.port.ContainerImageBuilder;
import fr.imt.distroforge.distroforge.business.utils.Constants;
import fr.imt.distroforge.distroforge.exception.ImageBuildException;
import fr.imt.distroforge.distroforge.infrastructure.docker.DockerImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Layers the rendered overlay on the rootfs image. The result is pushed to the configured
 * registry, or saved as a tarball when no registry is configured or the push fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DockerContainerImageBuilder implements ContainerImageBuilder {

    private static final String DOCKERFILE = "Dockerfile";

    private final DockerImageService dockerImageService;

    @Override
    public ToolResult<ContainerImage> buildImage(RootfsHandle rootfs, BuildLogSink logSink) {
        String imageTag = Constants.IMAGE_PREFIX + "-image-" + rootfs.buildId() + ":latest";
        try {
            Path contextDir = Files.createDirectories(rootfs.workspace().resolve("container"));
            FileSystemUtils.copyRecursively(rootfs.overlayDir(), contextDir.resolve(RootfsHandle.OVERLAY_DIRECTORY));
            Files.writeString(contextDir.resolve(DOCKERFILE), dockerfile(rootfs));

            dockerImageService.buildImage(logSink, contextDir, DOCKERFILE, imageTag,
                    rootfs.architecture().getDockerPlatform(),
                    Map.of(Constants.MANAGED_LABEL, "true", Constants.BUILD_LABEL, rootfs.buildId()));

            if (dockerImageService.isRegistryConfigured()) {
                try {
                    String reference = dockerImageService.pushImage(logSink, imageTag, rootfs.buildId());
                    return ToolResult.success(ContainerImage.pushed(imageTag, reference));
                } catch (ImageBuildException e) {
                    log.warn("Push failed for build {}, falling back to an image archive", rootfs.buildId(), e);
                    logSink.log("Registry push failed, saving image archive instead: " + e.getMessage());
                }
            } else {
                logSink.log("No registry configured, saving image archive");
            }

            Path archive = dockerImageService.saveImage(logSink, imageTag,
                    contextDir.resolve(Constants.IMAGE_PREFIX + "-" + rootfs.buildId() + ".tar"));
            // the archive is the artifact, the local image is no longer needed
            dockerImageService.removeImage(imageTag);
            return ToolResult.success(ContainerImage.archived(imageTag, archive));
        } catch (IOException e) {
            log.error("Failed to prepare container build context for {}", rootfs.buildId(), e);
            return ToolResult.failure("Failed to prepare container build context: " + e.getMessage());
        } catch (ImageBuildException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    String dockerfile(RootfsHandle rootfs) {
        return String.join("\n",
                "FROM " + rootfs.imageReference(),
                "COPY overlay/ /",
                "LABEL " + Constants.BUILD_LABEL + "=\"" + rootfs.buildId() + "\"") + "\n";
    }
}

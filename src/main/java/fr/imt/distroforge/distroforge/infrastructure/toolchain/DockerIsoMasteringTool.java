package fr.imt.distroforge.distroforge.infrastructure.toolchain;

import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Volume;
import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.port.ImageMasteringTool;
import fr.imt.distroforge.distroforge.business.utils.Constants;
import fr.imt.distroforge.distroforge.exception.DistroForgeException;
import fr.imt.distroforge.distroforge.infrastructure.docker.ContainerRunner;
import fr.imt.distroforge.distroforge.infrastructure.docker.DockerImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Masters the bootable image inside a privileged container: archiso for Arch, live-build for
 * Debian and Ubuntu, a rootfs tarball for Alpine. The configured overlay is copied into the image.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DockerIsoMasteringTool implements ImageMasteringTool {

    private static final String DOCKERFILE = "Dockerfile.iso";

    private final DockerImageService dockerImageService;
    private final ContainerRunner containerRunner;

    @Override
    public ToolResult<Path> masterIso(RootfsHandle rootfs, BuildLogSink logSink) {
        String imageTag = Constants.IMAGE_PREFIX + "-iso-" + rootfs.base().getValue() + "-" + rootfs.buildId() + ":latest";
        try {
            Path contextDir = Files.createDirectories(rootfs.workspace().resolve("iso"));
            Path outDir = Files.createDirectories(contextDir.resolve("out"));
            FileSystemUtils.copyRecursively(rootfs.overlayDir(), contextDir.resolve(RootfsHandle.OVERLAY_DIRECTORY));
            Files.writeString(contextDir.resolve(DOCKERFILE), dockerfile(rootfs));

            dockerImageService.buildImage(logSink, contextDir, DOCKERFILE, imageTag,
                    rootfs.architecture().getDockerPlatform(),
                    Map.of(Constants.MANAGED_LABEL, "true", Constants.BUILD_LABEL, rootfs.buildId()));

            List<Bind> binds = List.of(new Bind(outDir.toAbsolutePath().toString(), new Volume("/out")));
            int exitCode = containerRunner.run(rootfs.buildId(), "iso", imageTag, binds,
                    rootfs.base() != DistroBase.ALPINE, logSink);
            if (exitCode != 0) {
                return ToolResult.failure("Image mastering exited with code " + exitCode);
            }

            return findImage(outDir, rootfs.base())
                    .map(ToolResult::success)
                    .orElseGet(() -> ToolResult.failure("No bootable image was produced for " + rootfs.base().getValue()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Image mastering interrupted");
        } catch (IOException e) {
            log.error("Failed to prepare image mastering context for {}", rootfs.buildId(), e);
            return ToolResult.failure("Failed to prepare image mastering context: " + e.getMessage());
        } catch (DistroForgeException e) {
            return ToolResult.failure(e.getMessage());
        } finally {
            dockerImageService.removeImage(imageTag);
        }
    }

    private Optional<Path> findImage(Path outDir, DistroBase base) throws IOException {
        try (Stream<Path> files = Files.list(outDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return name.endsWith(".iso") || (base == DistroBase.ALPINE && name.endsWith(".tar"));
                    })
                    .findFirst();
        }
    }

    String dockerfile(RootfsHandle rootfs) {
        String packageList = String.join("\\n", rootfs.packages());
        return switch (rootfs.base()) {
            case ARCH -> """
                    FROM archlinux:latest
                    RUN pacman -Syu --noconfirm archiso
                    RUN cp -r /usr/share/archiso/configs/releng /releng
                    RUN printf '%s\\n' >> /releng/packages.x86_64
                    COPY overlay/ /releng/airootfs/
                    CMD ["mkarchiso", "-v", "-w", "/work", "-o", "/out", "/releng"]
                    """.formatted(packageList);
            case DEBIAN -> liveBuild("debian:bookworm",
                    "lb config --distribution bookworm --archive-areas \"main contrib non-free non-free-firmware\"",
                    packageList);
            case UBUNTU -> liveBuild("ubuntu:noble",
                    "lb config --distribution noble --archive-areas \"main restricted universe multiverse\""
                            + " --parent-mirror-bootstrap http://archive.ubuntu.com/ubuntu/",
                    packageList);
            case ALPINE -> """
                    FROM alpine:latest
                    RUN apk add --no-cache alpine-base linux-lts
                    RUN mkdir -p /iso/apks /iso/boot
                    RUN apk fetch --no-cache -o /iso/apks alpine-base linux-lts %s
                    RUN cp /boot/vmlinuz-lts /iso/boot/vmlinuz && cp /boot/initramfs-lts /iso/boot/initramfs
                    COPY overlay/ /iso/overlay/
                    CMD tar -cf /out/alpine-%s.tar -C /iso .
                    """.formatted(String.join(" ", rootfs.packages()), rootfs.buildId());
        };
    }

    private String liveBuild(String image, String configCommand, String packageList) {
        return """
                FROM %s
                RUN apt-get update && apt-get install -y live-build
                WORKDIR /build
                RUN %s
                RUN mkdir -p config/package-lists && printf '%s\\n' > config/package-lists/custom.list.chroot
                COPY overlay/ config/includes.chroot/
                CMD lb build && cp /build/*.iso /out/
                """.formatted(image, configCommand, packageList);
    }
}

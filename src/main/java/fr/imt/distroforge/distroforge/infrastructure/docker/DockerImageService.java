package fr.imt.distroforge.distroforge.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.BuildResponseItem;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.exception.ImageBuildException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Docker image build, push, save and removal on the configured daemon.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DockerImageService {

    private final DockerClient dockerClient;

    @Value("${distroforge.docker.registry.url:}")
    private String registryUrl;

    @Value("${distroforge.docker.registry.username:}")
    private String registryUsername;

    @Value("${distroforge.docker.registry.password:}")
    private String registryPassword;

    @Value("${distroforge.docker.registry.repository:distroforge}")
    private String registryRepository;

    @Value("${docker.timeout.seconds:3600}")
    private int timeoutSeconds;

    /**
     * Build an image from a context directory.
     *
     * @param contextDir     build context directory
     * @param dockerfileName Dockerfile inside the context
     * @param imageTag       full tag of the image (e.g. "distroforge-rootfs-1234:latest")
     * @param platform       target platform (e.g. "linux/amd64")
     * @return the built image ID
     */
    @Retryable(
        retryFor = {DockerException.class, ImageBuildException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public String buildImage(BuildLogSink logSink, Path contextDir, String dockerfileName, String imageTag,
                             String platform, Map<String, String> labels) {
        logSink.log("Starting image build: " + imageTag + " using " + dockerfileName);

        try {
            return dockerClient.buildImageCmd(contextDir.toFile())
                    .withDockerfile(contextDir.resolve(dockerfileName).toFile())
                    .withTags(Set.of(imageTag))
                    .withPlatform(platform)
                    .withLabels(labels)
                    .exec(new BuildImageResultCallback() {
                        @Override
                        public void onNext(BuildResponseItem item) {
                            if (item.getStream() != null && !item.getStream().isBlank()) {
                                logSink.log(item.getStream().trim());
                            }
                            super.onNext(item);
                        }
                    })
                    .awaitImageId();
        } catch (Exception e) {
            log.error("[DockerImageService] Image build failed for {}", imageTag, e);
            logSink.log("Image build failed: " + e.getMessage());
            throw new ImageBuildException(imageTag, "build", e);
        }
    }

    public boolean isRegistryConfigured() {
        return registryUsername != null && !registryUsername.isBlank();
    }

    /**
     * Tag a local image for the configured registry and push it.
     *
     * @return the pushed reference (repository:tag)
     */
    @Retryable(
        retryFor = {DockerException.class, ImageBuildException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public String pushImage(BuildLogSink logSink, String localImage, String tag) {
        String repository = registryPrefix() + registryUsername + "/" + registryRepository;
        String reference = repository + ":" + tag;
        logSink.log("Pushing image to registry: " + reference);

        try {
            dockerClient.tagImageCmd(localImage, repository, tag).exec();

            AuthConfig authConfig = new AuthConfig()
                    .withUsername(registryUsername)
                    .withPassword(registryPassword);
            if (registryUrl != null && !registryUrl.isBlank()) {
                authConfig.withRegistryAddress(registryUrl);
            }

            boolean completed = dockerClient.pushImageCmd(repository)
                    .withTag(tag)
                    .withAuthConfig(authConfig)
                    .start()
                    .awaitCompletion(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                throw new ImageBuildException("Push of " + reference + " timed out", null);
            }
            logSink.log("Image pushed successfully");
            return reference;
        } catch (ImageBuildException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageBuildException(reference, "push", e);
        } catch (Exception e) {
            log.error("[DockerImageService] Image push failed for {}", reference, e);
            logSink.log("Image push failed: " + e.getMessage());
            throw new ImageBuildException(reference, "push", e);
        }
    }

    /**
     * Export an image as a tarball, as {@code docker save} does.
     */
    public Path saveImage(BuildLogSink logSink, String imageTag, Path target) {
        logSink.log("Saving image " + imageTag + " to " + target.getFileName());
        try (InputStream image = dockerClient.saveImageCmd(imageTag).exec()) {
            Files.copy(image, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (Exception e) {
            log.error("[DockerImageService] Image save failed for {}", imageTag, e);
            throw new ImageBuildException(imageTag, "save", e);
        }
    }

    public void removeImage(String imageTag) {
        try {
            dockerClient.removeImageCmd(imageTag).withForce(true).exec();
            log.debug("Removed image {}", imageTag);
        } catch (NotFoundException e) {
            log.debug("Image {} already removed", imageTag);
        } catch (Exception e) {
            log.warn("[DockerImageService] Failed to remove image {}", imageTag, e);
        }
    }

    private String registryPrefix() {
        if (registryUrl == null || registryUrl.isBlank()) {
            return "";
        }
        return registryUrl.replaceFirst("^https?://", "").replaceAll("/+$", "") + "/";
    }
}

package fr.imt.distroforge.distroforge.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.HostConfig;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.business.utils.Constants;
import fr.imt.distroforge.distroforge.exception.ContainerExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a toolchain container to completion with build-scoped labels and streamed output.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContainerRunner {

    private final DockerClient dockerClient;
    private final ContainerLogStreamer containerLogStreamer;

    @Value("${docker.timeout.seconds:3600}")
    private int timeoutSeconds;

    @Value("${docker.memory.limit:2GB}")
    private DataSize memoryLimit;

    @Value("${docker.cpus:2}")
    private double cpus;

    @Value("${docker.pids-limit:100}")
    private long pidsLimit;

    /**
     * @return the exit code of the container
     * @throws InterruptedException        if the build thread is interrupted while the container runs
     * @throws ContainerExecutionException if the container cannot be created, started or awaited
     */
    public int run(String buildId, String purpose, String image, List<Bind> binds, boolean privileged,
                   BuildLogSink logSink) throws InterruptedException {
        String containerId = null;
        try {
            Map<String, String> labels = Map.of(
                    Constants.MANAGED_LABEL, "true",
                    Constants.BUILD_LABEL, buildId,
                    Constants.PURPOSE_LABEL, purpose
            );

            CreateContainerResponse container = dockerClient.createContainerCmd(image)
                    .withLabels(labels)
                    .withHostConfig(hostConfig(binds, privileged))
                    .exec();
            containerId = container.getId();
            logSink.log(String.format("Container created: %s", containerId.substring(0, 12)));

            dockerClient.startContainerCmd(containerId).exec();
            containerLogStreamer.streamLogs(containerId, logSink);

            Integer exitCode = dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback())
                    .awaitStatusCode(timeoutSeconds, TimeUnit.SECONDS);
            logSink.log(String.format("Container %s finished (Exit: %d)", containerId.substring(0, 12), exitCode));
            return exitCode;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Container execution failed for {} of build {}", purpose, buildId, e);
            throw new ContainerExecutionException(image, purpose, e);
        } finally {
            if (containerId != null) {
                try {
                    dockerClient.removeContainerCmd(containerId)
                            .withForce(true)
                            .exec();
                    log.debug("Container {} removed", containerId);
                } catch (Exception e) {
                    log.warn("Failed to remove container {}", containerId, e);
                }
            }
        }
    }

    /**
     * Sandbox limits of a toolchain container. A zero or negative limit leaves the resource unbounded;
     * swap is capped at the memory limit so that the container cannot swap.
     */
    HostConfig hostConfig(List<Bind> binds, boolean privileged) {
        HostConfig hostConfig = HostConfig.newHostConfig()
                .withPrivileged(privileged)
                .withBinds(binds.toArray(new Bind[0]))
                .withAutoRemove(false);
        if (memoryLimit != null && memoryLimit.toBytes() > 0) {
            hostConfig.withMemory(memoryLimit.toBytes()).withMemorySwap(memoryLimit.toBytes());
        }
        if (cpus > 0) {
            hostConfig.withNanoCPUs((long) (cpus * 1_000_000_000L));
        }
        if (pidsLimit > 0) {
            hostConfig.withPidsLimit(pidsLimit);
        }
        return hostConfig;
    }
}

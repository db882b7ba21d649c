package fr.imt.distroforge.distroforge.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.model.Frame;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
@Slf4j
public class ContainerLogStreamer {

    private final DockerClient dockerClient;

    @Value("${docker.timeout.seconds:3600}")
    private int timeoutSeconds;

    /**
     * Stream container output to the build log until the container stops.
     */
    public void streamLogs(String containerId, BuildLogSink logSink) throws InterruptedException {
        dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(true)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        String logLine = new String(frame.getPayload(), StandardCharsets.UTF_8).trim();
                        if (!logLine.isEmpty()) {
                            logSink.log(logLine);
                        }
                    }
                })
                .awaitCompletion(timeoutSeconds, TimeUnit.SECONDS);
    }
}

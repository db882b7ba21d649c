package fr.imt.distroforge.distroforge.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "distroforge.executor")
public class BuildExecutorProperties {

    /**
     * Builds running at the same time; further builds wait for a free worker.
     */
    private int maxConcurrentBuilds = 4;

    /**
     * How long shutdown waits for running builds.
     */
    private Duration shutdownTimeout = Duration.ofMinutes(1);

    private String threadNamePrefix = "build-";
}

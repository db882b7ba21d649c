package fr.imt.distroforge.distroforge.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "distroforge.retention")
public class RetentionProperties {

    private boolean enabled = false;

    /**
     * Finished builds older than this are evicted with their artifacts.
     */
    private Duration maxAge = Duration.ofHours(24);
}

package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.configuration.RetentionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Evicts finished builds, and their artifacts, once they are older than the retention period.
 */
@Component
@ConditionalOnProperty(prefix = "distroforge.retention", name = "enabled", havingValue = "true")
@Slf4j
public class BuildRetentionSweeper {

    private final BuildRecordStore buildRecordStore;
    private final ArtifactRegistry artifactRegistry;
    private final BuildDispatcher buildDispatcher;
    private final RetentionProperties properties;
    private final Clock clock;

    public BuildRetentionSweeper(BuildRecordStore buildRecordStore,
                                 ArtifactRegistry artifactRegistry,
                                 BuildDispatcher buildDispatcher,
                                 RetentionProperties properties,
                                 Clock clock) {
        this.buildRecordStore = buildRecordStore;
        this.artifactRegistry = artifactRegistry;
        this.buildDispatcher = buildDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${distroforge.retention.interval:PT1H}",
            initialDelayString = "${distroforge.retention.interval:PT1H}")
    public void scheduledSweep() {
        sweep();
    }

    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getMaxAge());
        int evicted = 0;
        for (BuildSnapshot build : buildRecordStore.findAll()) {
            if (build.status().isTerminal() && build.completedAt() != null && build.completedAt().isBefore(cutoff)) {
                artifactRegistry.deleteArtifacts(build.buildId());
                buildRecordStore.remove(build.buildId());
                buildDispatcher.forget(build.buildId());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} builds completed before {}", evicted, cutoff);
        }
        return evicted;
    }
}

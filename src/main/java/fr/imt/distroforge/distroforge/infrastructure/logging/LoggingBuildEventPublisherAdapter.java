package fr.imt.distroforge.distroforge.infrastructure.logging;

import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.port.BuildEventPublisherPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when no live event channel is configured. Log lines already reach the
 * application log through the aggregator, so only status changes are traced here.
 */
@Component
@ConditionalOnProperty(prefix = "distroforge.events.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingBuildEventPublisherAdapter implements BuildEventPublisherPort {

    @Override
    public void publishLog(String buildId, String message) {
        log.trace("[{}] event {}", buildId, message);
    }

    @Override
    public void publishStatus(String buildId, BuildStatus status, String currentStage) {
        log.debug("Build {} is {}{}", buildId, status, currentStage != null ? " (" + currentStage + ")" : "");
    }
}

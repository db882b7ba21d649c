package fr.imt.distroforge.distroforge.infrastructure.redis;

import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.port.BuildEventPublisherPort;
import fr.imt.distroforge.distroforge.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "distroforge.events.redis", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class RedisBuildEventPublisherAdapter implements BuildEventPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publishLog(String buildId, String message) {
        try {
            redisTemplate.convertAndSend(RedisConfiguration.LOGS_TOPIC, buildId + "|" + message);
        } catch (Exception e) {
            log.error("Failed to publish log line for build {}", buildId, e);
        }
    }

    @Override
    public void publishStatus(String buildId, BuildStatus status, String currentStage) {
        try {
            // buildId|status|currentStage
            String message = String.format("%s|%s|%s",
                    buildId,
                    status,
                    currentStage != null ? currentStage : "");
            redisTemplate.convertAndSend(RedisConfiguration.BUILD_STATUS_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to publish build status for build {}", buildId, e);
        }
    }
}

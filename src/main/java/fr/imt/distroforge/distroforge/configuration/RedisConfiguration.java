package fr.imt.distroforge.distroforge.configuration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(prefix = "distroforge.events.redis", name = "enabled", havingValue = "true")
public class RedisConfiguration {

    public static final String LOGS_TOPIC = "build-logs";
    public static final String BUILD_STATUS_TOPIC = "build-status";

    @Bean
    StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}

package fr.imt.distroforge.distroforge.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class BuildExecutorConfiguration {

    public static final String BUILD_TASK_EXECUTOR = "buildTaskExecutor";

    @Bean(name = BUILD_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor buildTaskExecutor(BuildExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentBuilds());
        executor.setMaxPoolSize(properties.getMaxConcurrentBuilds());
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownTimeout().toSeconds());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

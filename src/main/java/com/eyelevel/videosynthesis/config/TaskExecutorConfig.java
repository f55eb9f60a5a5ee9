package com.eyelevel.videosynthesis.config;

import org.springframework.boot.task.ThreadPoolTaskExecutorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Configures the thread pool generation jobs run on. Each job occupies one thread for its whole
 * submit → poll → download flow.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Pool sizes come from {@code spring.task.execution.pool.*} in application.yaml, applied
     * through Spring Boot's {@link ThreadPoolTaskExecutorBuilder}.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(ThreadPoolTaskExecutorBuilder builder) {
        // Initialized by the container through afterPropertiesSet.
        return builder.threadNamePrefix("generation-job-").build();
    }
}

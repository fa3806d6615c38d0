package com.example.slidecast_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the dedicated thread that {@link com.example.slidecast_backend.service.PipelineWorker} runs its
 * poll loop on. One thread per process: tasks are processed strictly one at a time.
 */
@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "pipelineWorkerExecutor")
    public ThreadPoolTaskExecutor pipelineWorkerExecutor(WorkerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("pipeline-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.max(1, properties.getShutdownTimeout().toSeconds()));
        executor.initialize();
        return executor;
    }
}

package com.example.slidecast_backend.config;

import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator taskQueueHealth(TaskQueue taskQueue) {
        return () -> {
            try {
                return Health.up().withDetail("pending", taskQueue.queueDepth()).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("taskQueue", "unreachable").build();
            }
        };
    }
}

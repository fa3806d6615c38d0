package com.example.slidecast_backend.config;

import com.example.slidecast_backend.repository.TaskRecordRepository;
import com.example.slidecast_backend.service.InMemoryKeyValueStore;
import com.example.slidecast_backend.service.JpaTaskMirror;
import com.example.slidecast_backend.service.KeyValueStateStore;
import com.example.slidecast_backend.service.KeyValueTaskQueue;
import com.example.slidecast_backend.service.RedisKeyValueStore;
import com.example.slidecast_backend.service.Interfaces.KeyValueStore;
import com.example.slidecast_backend.service.Interfaces.StateStore;
import com.example.slidecast_backend.service.Interfaces.TaskMirror;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Wires the key-value backend selected by {@code pipeline.store} and the state store and task queue on top of it.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class StoreConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "pipeline", name = "store", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        LOGGER.info("Key-value store wired: backend=redis");
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline", name = "store", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        LOGGER.warn("Key-value store wired: backend=memory (state is lost on restart)");
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    public TaskMirror taskMirror(TaskRecordRepository repository, PipelineProperties properties) {
        if (!properties.isAuditEnabled()) {
            return TaskMirror.NOOP;
        }
        return new JpaTaskMirror(repository);
    }

    @Bean
    public StateStore stateStore(KeyValueStore store, ObjectMapper objectMapper, PipelineProperties properties, Clock clock) {
        return new KeyValueStateStore(store, objectMapper, properties, clock);
    }

    @Bean
    public TaskQueue taskQueue(KeyValueStore store, ObjectMapper objectMapper, PipelineProperties properties,
                               TaskMirror taskMirror, Clock clock) {
        return new KeyValueTaskQueue(store, objectMapper, properties, taskMirror, clock);
    }
}

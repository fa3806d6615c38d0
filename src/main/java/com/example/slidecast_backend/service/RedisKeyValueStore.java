package com.example.slidecast_backend.service;

import com.example.slidecast_backend.service.Interfaces.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link KeyValueStore} on Redis. Lists are pushed on the left and popped on the right, so the list is a FIFO.
 */
public class RedisKeyValueStore implements KeyValueStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final StringRedisTemplate redis;

    public RedisKeyValueStore(StringRedisTemplate redis) {
        this.redis = redis;
        LOGGER.info("RedisKeyValueStore ready");
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value) {
        redis.opsForValue().set(key, value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public void pushTail(String listKey, String value) {
        redis.opsForList().leftPush(listKey, value);
    }

    @Override
    public Optional<String> popHead(String listKey, Duration timeout) {
        return Optional.ofNullable(redis.opsForList().rightPop(listKey, timeout));
    }

    @Override
    public long removeFromList(String listKey, String value) {
        Long removed = redis.opsForList().remove(listKey, 1, value);
        return removed == null ? 0 : removed;
    }

    @Override
    public long listSize(String listKey) {
        Long size = redis.opsForList().size(listKey);
        return size == null ? 0 : size;
    }
}

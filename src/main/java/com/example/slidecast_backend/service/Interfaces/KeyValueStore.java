package com.example.slidecast_backend.service.Interfaces;

import java.time.Duration;
import java.util.Optional;

/**
 * The small slice of a key-value server the pipeline needs: string values with optional expiry and
 * FIFO lists with a blocking pop. Values pushed with {@link #pushTail} come out of {@link #popHead} in
 * insertion order.
 */
public interface KeyValueStore {
    Optional<String> get(String key);

    void set(String key, String value);

    /** Stores the value and (re)starts its expiry. */
    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    void pushTail(String listKey, String value);

    /**
     * Removes and returns the oldest element, waiting up to {@code timeout} for one to arrive.
     *
     * @return the element, or empty when the timeout elapsed.
     */
    Optional<String> popHead(String listKey, Duration timeout);

    /** Removes at most one occurrence of {@code value}; returns the number removed. */
    long removeFromList(String listKey, String value);

    long listSize(String listKey);
}

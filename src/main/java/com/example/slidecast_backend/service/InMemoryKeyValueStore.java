package com.example.slidecast_backend.service;

import com.example.slidecast_backend.service.Interfaces.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link KeyValueStore} for tests and single-node runs. Expiry is evaluated lazily against the clock.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Clock clock;
    private final Map<String, Entry> values = new ConcurrentHashMap<>();
    private final Map<String, BlockingDeque<String>> lists = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value) {
        values.put(key, new Entry(value, null));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public boolean delete(String key) {
        return values.remove(key) != null | lists.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return live(key) != null || listSize(key) > 0;
    }

    @Override
    public void pushTail(String listKey, String value) {
        list(listKey).addLast(value);
    }

    @Override
    public Optional<String> popHead(String listKey, Duration timeout) {
        try {
            return Optional.ofNullable(list(listKey).pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public long removeFromList(String listKey, String value) {
        return list(listKey).removeFirstOccurrence(value) ? 1 : 0;
    }

    @Override
    public long listSize(String listKey) {
        BlockingDeque<String> deque = lists.get(listKey);
        return deque == null ? 0 : deque.size();
    }

    /** Remaining time to live, empty for missing or non-expiring keys. */
    public Optional<Duration> ttl(String key) {
        Entry entry = live(key);
        if (entry == null || entry.expiresAt() == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), entry.expiresAt()));
    }

    private Entry live(String key) {
        Entry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            values.remove(key, entry);
            return null;
        }
        return entry;
    }

    private BlockingDeque<String> list(String listKey) {
        return lists.computeIfAbsent(listKey, k -> new LinkedBlockingDeque<>());
    }

    private record Entry(String value, Instant expiresAt) {}
}

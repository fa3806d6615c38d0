package com.example.slidecast_backend.support;

import com.example.slidecast_backend.config.PipelineProperties;
import com.example.slidecast_backend.service.InMemoryKeyValueStore;
import com.example.slidecast_backend.service.KeyValueStateStore;
import com.example.slidecast_backend.service.KeyValueTaskQueue;
import com.example.slidecast_backend.service.Interfaces.TaskMirror;

/**
 * In-memory queue and state store sharing one keyspace, for tests that exercise the real implementations.
 */
public final class InMemoryStores {
    public final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    public final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    public final PipelineProperties properties = new PipelineProperties();
    public final KeyValueTaskQueue queue;
    public final KeyValueStateStore states;

    public InMemoryStores() {
        this(TaskMirror.NOOP);
    }

    public InMemoryStores(TaskMirror mirror) {
        this.queue = new KeyValueTaskQueue(store, TestJson.mapper(), properties, mirror, clock);
        this.states = new KeyValueStateStore(store, TestJson.mapper(), properties, clock);
    }
}

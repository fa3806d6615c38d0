package com.example.slidecast_backend.service.Interfaces;

import com.example.slidecast_backend.model.Task;

/**
 * Receives a copy of every task write. Implementations must not throw.
 */
public interface TaskMirror {
    TaskMirror NOOP = task -> { };

    void record(Task task);
}

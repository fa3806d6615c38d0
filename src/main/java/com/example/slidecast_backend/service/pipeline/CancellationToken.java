package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.service.Interfaces.TaskQueue;

@FunctionalInterface
public interface CancellationToken {
    CancellationToken NEVER = () -> false;

    boolean isCancelled();

    static CancellationToken forTask(TaskQueue taskQueue, String taskId) {
        if (taskId == null) {
            return NEVER;
        }
        return () -> taskQueue.isTaskCancelled(taskId);
    }
}

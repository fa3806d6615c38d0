package com.example.slidecast_backend.service;

import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.model.TaskRecord;
import com.example.slidecast_backend.repository.TaskRecordRepository;
import com.example.slidecast_backend.service.Interfaces.TaskMirror;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies task writes into {@code task_record}. The key-value store stays authoritative; a failed
 * copy is logged and dropped.
 */
public class JpaTaskMirror implements TaskMirror {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaTaskMirror.class);

    private final TaskRecordRepository repository;

    public JpaTaskMirror(TaskRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public void record(Task task) {
        try {
            TaskRecord record = repository.findById(task.getTaskId())
                    .map(existing -> {
                        existing.copyStatus(task);
                        return existing;
                    })
                    .orElseGet(() -> TaskRecord.of(task));
            repository.save(record);
        } catch (Exception e) {
            LOGGER.warn("MIRROR write failed taskId={} status={} err={}", task.getTaskId(), task.getStatus(), e.toString());
        }
    }
}

package com.example.slidecast_backend.service;

import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.service.Interfaces.TaskMirror;
import com.example.slidecast_backend.service.Interfaces.TaskQueue;
import com.example.slidecast_backend.support.InMemoryStores;
import com.example.slidecast_backend.util.TaskStatus;
import com.example.slidecast_backend.util.TaskType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeyValueTaskQueueTest {

    private static final Duration POLL = Duration.ofMillis(10);

    private final InMemoryStores stores = new InMemoryStores();
    private final KeyValueTaskQueue queue = stores.queue;

    @Test
    void submitPersistsQueuedTaskAndDequeuesInFifoOrder() {
        String first = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), "owner-1");
        String second = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u2"), null);

        Task stored = queue.getTask(first).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(stored.uploadId()).isEqualTo("u1");
        assertThat(stored.getOwnerId()).isEqualTo("owner-1");
        assertThat(queue.queueDepth()).isEqualTo(2);

        assertThat(queue.getNextTask(POLL)).map(Task::getTaskId).contains(first);
        assertThat(queue.getNextTask(POLL)).map(Task::getTaskId).contains(second);
        assertThat(queue.getNextTask(POLL)).isEmpty();
    }

    @Test
    void updateTaskStatusReturnsFalseForUnknownTask() {
        assertThat(queue.updateTaskStatus("nope", TaskStatus.COMPLETED, null)).isFalse();

        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        assertThat(queue.updateTaskStatus(id, TaskStatus.FAILED, "boom")).isTrue();
        assertThat(queue.getTask(id).orElseThrow().getError()).isEqualTo("boom");
    }

    @Test
    void cancellingQueuedTaskRemovesItFromTheQueue() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);

        assertThat(queue.cancelTask(id)).isTrue();

        Task task = queue.getTask(id).orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.getError()).isEqualTo(TaskQueue.CANCELLED_BY_USER);
        assertThat(queue.queueDepth()).isZero();
        assertThat(queue.isTaskCancelled(id)).isTrue();
        assertThat(stores.store.exists("ss:task:" + id + ":cancelled")).isFalse();
    }

    @Test
    void cancellingRunningTaskWritesShortLivedMarker() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        queue.getNextTask(POLL);
        queue.updateTaskStatus(id, TaskStatus.PROCESSING, null);

        assertThat(queue.cancelTask(id)).isTrue();

        assertThat(queue.getTask(id).orElseThrow().getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(stores.store.ttl("ss:task:" + id + ":cancelled")).contains(Duration.ofMinutes(5));
        assertThat(queue.isTaskCancelled(id)).isTrue();
    }

    @Test
    void markerAloneIsEnoughToReportCancellation() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        queue.updateTaskStatus(id, TaskStatus.PROCESSING, null);
        queue.cancelTask(id);
        // a late status write from the worker overwrites CANCELLED
        queue.updateTaskStatus(id, TaskStatus.PROCESSING, null);

        assertThat(queue.isTaskCancelled(id)).isTrue();

        stores.clock.advance(Duration.ofMinutes(6));
        assertThat(queue.isTaskCancelled(id)).isFalse();
    }

    @Test
    void finishedOrUnknownTasksCannotBeCancelled() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        queue.updateTaskStatus(id, TaskStatus.COMPLETED, null);

        assertThat(queue.cancelTask(id)).isFalse();
        assertThat(queue.cancelTask("unknown")).isFalse();
        assertThat(queue.getTask(id).orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void enqueueExistingTaskRequeuesCancelledTaskAndClearsMarker() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        queue.getNextTask(POLL);
        queue.updateTaskStatus(id, TaskStatus.PROCESSING, null);
        queue.cancelTask(id);

        assertThat(queue.enqueueExistingTask(id)).isTrue();

        Task task = queue.getTask(id).orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getError()).isNull();
        assertThat(queue.isTaskCancelled(id)).isFalse();
        assertThat(queue.getNextTask(POLL)).map(Task::getTaskId).contains(id);
    }

    @Test
    void enqueueExistingTaskRefusesRunningAndUnknownTasks() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        queue.getNextTask(POLL);
        queue.updateTaskStatus(id, TaskStatus.PROCESSING, null);

        assertThat(queue.enqueueExistingTask(id)).isFalse();
        assertThat(queue.enqueueExistingTask("unknown")).isFalse();
        assertThat(queue.queueDepth()).isZero();
    }

    @Test
    void requeueOfQueuedTaskDoesNotDuplicateIt() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);

        assertThat(queue.enqueueExistingTask(id)).isTrue();

        assertThat(queue.queueDepth()).isEqualTo(1);
    }

    @Test
    void mirrorReceivesEveryWriteAndItsFailuresDoNotPropagate() {
        List<TaskStatus> mirrored = new ArrayList<>();
        TaskMirror flaky = task -> {
            mirrored.add(task.getStatus());
            throw new IllegalStateException("db down");
        };
        KeyValueTaskQueue mirroredQueue = new InMemoryStores(flaky).queue;

        String id = mirroredQueue.submit(TaskType.PROCESS_PRESENTATION, Map.of("upload_id", "u1"), null);
        mirroredQueue.updateTaskStatus(id, TaskStatus.PROCESSING, null);
        mirroredQueue.updateTaskStatus(id, TaskStatus.COMPLETED, null);

        assertThat(mirrored).containsExactly(TaskStatus.QUEUED, TaskStatus.PROCESSING, TaskStatus.COMPLETED);
        assertThat(mirroredQueue.getTask(id).orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void kwargsSurviveRoundTrip() {
        String id = queue.submit(TaskType.PROCESS_PRESENTATION,
                Map.of("upload_id", "u1", "generate_avatar", true, "voice_language", "german"), null);

        Map<String, Object> kwargs = queue.getTask(id).orElseThrow().getKwargs();
        assertThat(kwargs).containsEntry("generate_avatar", true).containsEntry("voice_language", "german");
    }
}

package com.example.slidecast_backend.service;

import com.example.slidecast_backend.dto.web.SubmitTaskRequest;
import com.example.slidecast_backend.dto.web.UploadProgress;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.Task;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.repository.TaskRecordRepository;
import com.example.slidecast_backend.support.InMemoryStores;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.example.slidecast_backend.util.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TaskServiceTest {

    private InMemoryStores stores;
    private TaskRecordRepository repository;
    private TaskService service;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores();
        repository = mock(TaskRecordRepository.class);
        service = new TaskService(stores.queue, stores.states, repository);
    }

    @Test
    void submitCarriesOnlyProvidedOptions() {
        String taskId = service.submit(new SubmitTaskRequest(" u1 ", "decks/u1.pdf", "Japanese", " ", null, false, "owner-1"));

        Task task = service.getTask(taskId).orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getOwnerId()).isEqualTo("owner-1");
        assertThat(task.getKwargs())
                .containsEntry(Task.UPLOAD_ID, "u1")
                .containsEntry(Task.FILE_PATH, "decks/u1.pdf")
                .containsEntry("voice_language", "Japanese")
                .containsEntry("generate_subtitles", false)
                .doesNotContainKeys("subtitle_language", "generate_avatar");
        assertThat(stores.queue.queueDepth()).isEqualTo(1);
    }

    @Test
    void cancelAndRetryDelegateToTheQueue() {
        String taskId = service.submit(new SubmitTaskRequest("u1", null, null, null, null, null, null));

        assertThat(service.cancel(taskId)).isTrue();
        assertThat(service.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(stores.queue.queueDepth()).isZero();

        assertThat(service.retry(taskId)).isTrue();
        assertThat(service.getTask(taskId).orElseThrow().getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(stores.queue.queueDepth()).isEqualTo(1);
        assertThat(service.cancel("missing")).isFalse();
    }

    @Test
    void progressCountsCompletedStepsOutOfNonSkipped() {
        stores.states.createState("u1", "t1", PipelineConfig.defaults(), List.of(
                StepName.EXTRACT, StepName.CONVERT_TO_IMAGES, StepName.GENERATE_AVATAR_VIDEOS, StepName.COMPOSE));
        stores.states.updateStepStatus("u1", StepName.EXTRACT, StepStatus.COMPLETED, null, null);
        stores.states.updateStepStatus("u1", StepName.GENERATE_AVATAR_VIDEOS, StepStatus.SKIPPED, null, null);

        UploadProgress progress = service.getProgress("u1").orElseThrow();

        assertThat(progress.progress()).isEqualTo(33);
        assertThat(progress.taskId()).isEqualTo("t1");
        assertThat(progress.steps()).extracting(UploadProgress.StepView::key).containsExactly(
                StepName.EXTRACT.key(), StepName.CONVERT_TO_IMAGES.key(),
                StepName.GENERATE_AVATAR_VIDEOS.key(), StepName.COMPOSE.key());
        assertThat(progress.steps().get(0).name()).isEqualTo(StepName.EXTRACT.displayName());
        assertThat(service.getProgress("missing")).isEmpty();
    }

    @Test
    void percentCompleteIsZeroWithoutCountableSteps() {
        assertThat(TaskService.percentComplete(new UploadState("u1", PipelineConfig.defaults()))).isZero();
    }

    @Test
    void listByOwnerClampsTheLimit() {
        service.listByOwner("owner-1", 10_000);
        verify(repository).findByOwnerIdOrderByCreatedAtDesc("owner-1", PageRequest.of(0, TaskService.MAX_LIST_SIZE));

        service.listByOwner("owner-2", 0);
        verify(repository).findByOwnerIdOrderByCreatedAtDesc("owner-2", PageRequest.of(0, 1));
    }
}

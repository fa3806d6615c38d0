package com.example.slidecast_backend.controller;

import com.example.slidecast_backend.dto.web.CancelResponse;
import com.example.slidecast_backend.dto.web.SubmitTaskRequest;
import com.example.slidecast_backend.dto.web.SubmitTaskResponse;
import com.example.slidecast_backend.dto.web.TaskRecordView;
import com.example.slidecast_backend.dto.web.TaskView;
import com.example.slidecast_backend.service.TaskService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/v1/tasks")
public class TasksController {
    private final TaskService taskService;

    public TasksController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitTaskResponse submit(@Valid @RequestBody SubmitTaskRequest request) {
        return new SubmitTaskResponse(taskService.submit(request));
    }

    @GetMapping("/{taskId}")
    public TaskView get(@PathVariable String taskId) {
        return taskService.getTask(taskId)
                .map(TaskView::of)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND"));
    }

    @PostMapping("/{taskId}/cancel")
    public CancelResponse cancel(@PathVariable String taskId) {
        if (taskService.getTask(taskId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND");
        }
        if (!taskService.cancel(taskId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "TASK_NOT_CANCELLABLE");
        }
        return new CancelResponse(taskId, true);
    }

    @PostMapping("/{taskId}/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitTaskResponse retry(@PathVariable String taskId) {
        if (taskService.getTask(taskId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND");
        }
        if (!taskService.retry(taskId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "TASK_RUNNING");
        }
        return new SubmitTaskResponse(taskId);
    }

    @GetMapping
    public List<TaskRecordView> listByOwner(@RequestParam String ownerId,
                                            @RequestParam(defaultValue = "50") int limit) {
        if (ownerId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "OWNER_REQUIRED");
        }
        return taskService.listByOwner(ownerId, limit).stream().map(TaskRecordView::of).toList();
    }
}

package com.example.slidecast_backend.controller;

import com.example.slidecast_backend.dto.web.TaskRecordView;
import com.example.slidecast_backend.dto.web.UploadProgress;
import com.example.slidecast_backend.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/v1/uploads")
public class UploadsController {
    private final TaskService taskService;

    public UploadsController(TaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping("/{uploadId}/progress")
    public UploadProgress progress(@PathVariable String uploadId) {
        return taskService.getProgress(uploadId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "UPLOAD_NOT_FOUND"));
    }

    @GetMapping("/{uploadId}/tasks")
    public List<TaskRecordView> tasks(@PathVariable String uploadId) {
        return taskService.listByUpload(uploadId).stream().map(TaskRecordView::of).toList();
    }
}

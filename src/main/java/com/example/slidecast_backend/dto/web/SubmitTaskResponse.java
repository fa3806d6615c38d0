package com.example.slidecast_backend.dto.web;

public record SubmitTaskResponse(String taskId) {}

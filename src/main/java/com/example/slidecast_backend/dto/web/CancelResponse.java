package com.example.slidecast_backend.dto.web;

public record CancelResponse(String taskId, boolean cancelled) {}

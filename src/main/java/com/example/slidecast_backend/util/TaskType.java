package com.example.slidecast_backend.util;

public enum TaskType {
    PROCESS_PRESENTATION
}

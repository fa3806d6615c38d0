package com.example.slidecast_backend.model;

import java.time.Instant;

public record ErrorEntry(String step, String message, Instant timestamp) {
}

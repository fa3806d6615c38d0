package com.example.slidecast_backend.dto.pipeline;

public record ImageAnalysis(int slideNumber, String analysis) {
}

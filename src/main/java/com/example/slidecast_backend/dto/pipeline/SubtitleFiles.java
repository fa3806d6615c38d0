package com.example.slidecast_backend.dto.pipeline;

public record SubtitleFiles(String language, String srtKey, long srtSize, String vttKey, long vttSize) {
}

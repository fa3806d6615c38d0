package com.example.slidecast_backend.dto.pipeline;

/**
 * A media file produced for one slide.
 *
 * @param slideNumber 1-based slide number.
 * @param objectKey   key of the file in the output storage.
 * @param durationMs  playback duration when known, otherwise {@code null}.
 */
public record SlideFile(int slideNumber, String objectKey, Long durationMs) {
    public SlideFile(int slideNumber, String objectKey) {
        this(slideNumber, objectKey, null);
    }
}

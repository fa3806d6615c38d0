package com.example.slidecast_backend.dto.pipeline;

import java.util.List;

/**
 * Final artifact of a pipeline run.
 *
 * @param videoKey  output storage key of the composed video.
 * @param subtitles subtitle files, {@code null} when subtitles were disabled.
 * @param slides    how each slide was composed.
 */
public record ComposedVideo(String videoKey, SubtitleFiles subtitles, List<SlideComposition> slides) {
    public ComposedVideo {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }
}

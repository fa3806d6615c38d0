package com.example.slidecast_backend.util;

import com.example.slidecast_backend.dto.pipeline.ComposedVideo;
import com.example.slidecast_backend.dto.pipeline.ImageAnalyses;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideContents;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline steps. Each step stores exactly one payload type under its key in the upload state.
 */
public enum StepName {
    EXTRACT("extract", "Extracting presentation content", SlideContents.class),
    CONVERT_TO_IMAGES("convert_to_images", "Converting slides to images", SlideFiles.class),
    ANALYZE_IMAGES("analyze_images", "Analyzing visual content", ImageAnalyses.class),
    GENERATE_SCRIPTS("generate_scripts", "Generating AI narratives", ScriptSet.class),
    REVIEW_SCRIPTS("review_scripts", "Reviewing and refining scripts", ScriptSet.class),
    GENERATE_SUBTITLE_SCRIPTS("generate_subtitle_scripts", "Generating subtitle narratives", ScriptSet.class),
    REVIEW_SUBTITLE_SCRIPTS("review_subtitle_scripts", "Reviewing subtitle scripts", ScriptSet.class),
    GENERATE_AUDIO("generate_audio", "Synthesizing voice audio", SlideFiles.class),
    GENERATE_AVATAR_VIDEOS("generate_avatar_videos", "Creating AI presenter videos", SlideFiles.class),
    COMPOSE("compose", "Composing final presentation", ComposedVideo.class);

    private final String key;
    private final String displayName;
    private final Class<?> payloadType;

    StepName(String key, String displayName, Class<?> payloadType) {
        this.key = key;
        this.displayName = displayName;
        this.payloadType = payloadType;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    public static Optional<StepName> fromKey(String key) {
        return Arrays.stream(values()).filter(s -> s.key.equals(key)).findFirst();
    }
}

package com.example.slidecast_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;
import java.util.Map;

/**
 * Per-upload pipeline options. The step set of a run is derived from these values.
 *
 * @param audioLanguage     narration language.
 * @param subtitleLanguage  subtitle language, {@code null} means "same as audio".
 * @param generateAvatar    render a presenter video per slide.
 * @param generateSubtitles write SRT/VTT files next to the composed video.
 */
public record PipelineConfig(String audioLanguage,
                             String subtitleLanguage,
                             boolean generateAvatar,
                             boolean generateSubtitles) {

    public static final String DEFAULT_LANGUAGE = "english";

    public PipelineConfig {
        audioLanguage = normalize(audioLanguage);
        if (audioLanguage == null) {
            audioLanguage = DEFAULT_LANGUAGE;
        }
        subtitleLanguage = normalize(subtitleLanguage);
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_LANGUAGE, null, false, true);
    }

    @JsonIgnore
    public String effectiveSubtitleLanguage() {
        return subtitleLanguage != null ? subtitleLanguage : audioLanguage;
    }

    @JsonIgnore
    public boolean hasSeparateSubtitleLanguage() {
        return !audioLanguage.equals(effectiveSubtitleLanguage());
    }

    /**
     * Reads options from a task parameter bag. Unknown keys are ignored; missing keys fall back to defaults.
     */
    public static PipelineConfig fromKwargs(Map<String, Object> kwargs) {
        if (kwargs == null) {
            return defaults();
        }
        Object voice = kwargs.containsKey("voice_language") ? kwargs.get("voice_language") : kwargs.get("language");
        return new PipelineConfig(
                voice == null ? null : String.valueOf(voice),
                kwargs.get("subtitle_language") == null ? null : String.valueOf(kwargs.get("subtitle_language")),
                flag(kwargs.get("generate_avatar"), false),
                flag(kwargs.get("generate_subtitles"), true));
    }

    private static boolean flag(Object value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static String normalize(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }
}

package com.example.slidecast_backend.dto.web;

import com.example.slidecast_backend.service.pipeline.StepContext;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param uploadId one path segment of letters, digits, {@code _} or {@code -}.
 * @param filePath key of the uploaded document in the raw storage area.
 */
public record SubmitTaskRequest(
        @NotBlank @Pattern(regexp = StepContext.UPLOAD_ID_REGEX) String uploadId,
        String filePath,
        String voiceLanguage,
        String subtitleLanguage,
        Boolean generateAvatar,
        Boolean generateSubtitles,
        @Size(max = 128) String ownerId
) {}

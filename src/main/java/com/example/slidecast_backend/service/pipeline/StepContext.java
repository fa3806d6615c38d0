package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.model.PipelineConfig;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Everything a handler gets to see.
 *
 * @param sourceFile uploaded document, {@code null} when the task did not carry a file path.
 * @param inputs     typed payloads of the handler's declared input steps.
 */
public record StepContext(String uploadId,
                          String taskId,
                          PipelineConfig config,
                          Path sourceFile,
                          StepInputs inputs) {

    /** Upload ids become a single path segment of storage keys. */
    public static final String UPLOAD_ID_REGEX = "[A-Za-z0-9_-]{1,128}";
    private static final Pattern UPLOAD_ID = Pattern.compile(UPLOAD_ID_REGEX);

    /** Out-area key for intermediate media of this upload; removed after a successful run. */
    public String workKey(String name) {
        return workPrefix(uploadId) + name;
    }

    /** Out-area key for final artifacts of this upload. */
    public String outputKey(String name) {
        return uploadPrefix(uploadId) + name;
    }

    public static String workPrefix(String uploadId) {
        return uploadPrefix(uploadId) + "work/";
    }

    public static boolean isValidUploadId(String uploadId) {
        return uploadId != null && UPLOAD_ID.matcher(uploadId).matches();
    }

    private static String uploadPrefix(String uploadId) {
        if (!isValidUploadId(uploadId)) {
            throw new IllegalArgumentException("Invalid upload id: " + uploadId);
        }
        return "uploads/" + uploadId + "/";
    }
}

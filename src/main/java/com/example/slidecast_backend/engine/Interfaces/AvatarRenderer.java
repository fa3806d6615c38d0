package com.example.slidecast_backend.engine.Interfaces;

public interface AvatarRenderer extends NamedProvider {
    /**
     * Renders a presenter video speaking {@code script}, lip-synced to the audio at {@code audioKey}.
     */
    void render(String script, String audioKey, String objectKey) throws Exception;
}

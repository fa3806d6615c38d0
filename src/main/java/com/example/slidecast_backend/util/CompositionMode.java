package com.example.slidecast_backend.util;

/**
 * How a single slide ends up in the composed video, depending on which media were produced for it.
 */
public enum CompositionMode {
    AVATAR_AND_AUDIO,
    AUDIO_AND_IMAGE,
    IMAGE_ONLY
}

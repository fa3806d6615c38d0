package com.example.slidecast_backend.engine.Interfaces;

import com.example.slidecast_backend.util.CompositionMode;

import java.util.List;

public interface VideoComposer extends NamedProvider {

    /**
     * One slide of the final video. Keys that the mode does not use are {@code null}.
     */
    record Segment(int slideNumber, CompositionMode mode, String imageKey, String audioKey, String avatarKey,
                   long durationMs) {}

    void compose(List<Segment> segments, String objectKey) throws Exception;
}

package com.example.slidecast_backend.engine.Interfaces;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;

import java.util.List;

/**
 * Language-model backed narration writer.
 */
public interface ScriptWriter extends NamedProvider {
    /**
     * Writes the narration for one slide.
     *
     * @param imageAnalysis description of the slide image, may be {@code null}.
     */
    String generate(int slideNumber, String slideText, String imageAnalysis, String language) throws Exception;

    /**
     * Reviews the whole script set for flow and consistency. Must return one entry per input entry.
     */
    List<ScriptEntry> review(List<ScriptEntry> scripts, String language) throws Exception;
}

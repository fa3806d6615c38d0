package com.example.slidecast_backend.service.Interfaces;

import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.dto.pipeline.SubtitleFiles;

public interface SubtitleService {
    /**
     * Writes SRT and VTT files for the given scripts, timed against the per-slide audio durations.
     *
     * @param keyPrefix out-area prefix the files are written under.
     */
    SubtitleFiles writeSubtitles(String keyPrefix, ScriptSet scripts, SlideFiles audio);
}

package com.example.slidecast_backend.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * Per-slide media produced by a step. Slides without an entry are legitimately absent
 * (a fan-out step may complete with a subset of its items).
 */
public record SlideFiles(List<SlideFile> files) {
    public SlideFiles {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public Optional<SlideFile> forSlide(int slideNumber) {
        return files.stream().filter(f -> f.slideNumber() == slideNumber).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return files.isEmpty();
    }
}

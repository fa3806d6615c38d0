package com.example.slidecast_backend.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * Narration scripts for all slides, written in a single language.
 */
public record ScriptSet(String language, List<ScriptEntry> scripts) {
    public ScriptSet {
        scripts = scripts == null ? List.of() : List.copyOf(scripts);
    }

    public Optional<ScriptEntry> forSlide(int slideNumber) {
        return scripts.stream().filter(s -> s.slideNumber() == slideNumber).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return scripts.isEmpty();
    }
}

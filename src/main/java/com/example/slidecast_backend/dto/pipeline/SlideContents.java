package com.example.slidecast_backend.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Text extracted from the source document, one entry per slide in document order.
 */
public record SlideContents(List<String> slides) {
    public SlideContents {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return slides.isEmpty();
    }
}

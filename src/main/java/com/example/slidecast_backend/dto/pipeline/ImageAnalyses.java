package com.example.slidecast_backend.dto.pipeline;

import java.util.List;
import java.util.Optional;

public record ImageAnalyses(List<ImageAnalysis> analyses) {
    public ImageAnalyses {
        analyses = analyses == null ? List.of() : List.copyOf(analyses);
    }

    public Optional<String> forSlide(int slideNumber) {
        return analyses.stream()
                .filter(a -> a.slideNumber() == slideNumber)
                .map(ImageAnalysis::analysis)
                .findFirst();
    }
}

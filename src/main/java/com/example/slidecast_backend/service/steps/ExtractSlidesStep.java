package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.SlideContents;
import com.example.slidecast_backend.engine.Interfaces.SlideExtractor;
import com.example.slidecast_backend.exception.StepValidationException;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.List;
import java.util.Set;

@Component
public class ExtractSlidesStep implements StepHandler<SlideContents> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractSlidesStep.class);

    private final ProviderChain<SlideExtractor> extractors;

    public ExtractSlidesStep(List<SlideExtractor> extractors) {
        this.extractors = new ProviderChain<>("slide extraction", extractors);
    }

    @Override
    public StepName step() {
        return StepName.EXTRACT;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of();
    }

    @Override
    public SlideContents execute(StepContext context) {
        if (context.sourceFile() == null || !Files.isRegularFile(context.sourceFile())) {
            throw new StepValidationException("Source file not found: " + context.sourceFile());
        }
        List<String> slides = extractors.call(context.sourceFile().getFileName().toString(),
                extractor -> extractor.extract(context.sourceFile()));
        if (slides == null || slides.isEmpty()) {
            throw new StepValidationException("No slides found in " + context.sourceFile().getFileName());
        }
        LOGGER.info("EXTRACT uploadId={} slides={}", context.uploadId(), slides.size());
        return new SlideContents(slides);
    }
}

package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ImageAnalyses;
import com.example.slidecast_backend.dto.pipeline.ImageAnalysis;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.engine.Interfaces.VisionAnalyzer;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import com.example.slidecast_backend.service.pipeline.FanOut;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Describes each slide image. Slides whose analysis fails are left out; script generation works without it.
 */
@Component
public class AnalyzeImagesStep implements StepHandler<ImageAnalyses> {
    private final ProviderChain<VisionAnalyzer> analyzers;
    private final StorageService storageService;

    public AnalyzeImagesStep(List<VisionAnalyzer> analyzers, StorageService storageService) {
        this.analyzers = new ProviderChain<>("image analysis", analyzers);
        this.storageService = storageService;
    }

    @Override
    public StepName step() {
        return StepName.ANALYZE_IMAGES;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.CONVERT_TO_IMAGES);
    }

    @Override
    public ImageAnalyses execute(StepContext context) {
        SlideFiles images = context.inputs().require(StepName.CONVERT_TO_IMAGES, SlideFiles.class);
        List<ImageAnalysis> analyses = FanOut.run("image analysis " + context.uploadId(), images.files(),
                        image -> "slide " + image.slideNumber(),
                        image -> analyze(image))
                .successesOrThrow();
        return new ImageAnalyses(analyses);
    }

    private ImageAnalysis analyze(SlideFile image) {
        String text = analyzers.call("slide " + image.slideNumber(),
                analyzer -> analyzer.analyze(storageService.resolveOut(image.objectKey())));
        return new ImageAnalysis(image.slideNumber(), text);
    }
}

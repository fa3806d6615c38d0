package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.SlideContents;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.engine.Interfaces.SlideRasterizer;
import com.example.slidecast_backend.exception.StepValidationException;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class ConvertSlidesStep implements StepHandler<SlideFiles> {
    private final ProviderChain<SlideRasterizer> rasterizers;

    public ConvertSlidesStep(List<SlideRasterizer> rasterizers) {
        this.rasterizers = new ProviderChain<>("slide rasterizing", rasterizers);
    }

    @Override
    public StepName step() {
        return StepName.CONVERT_TO_IMAGES;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.EXTRACT);
    }

    @Override
    public SlideFiles execute(StepContext context) {
        if (context.sourceFile() == null) {
            throw new StepValidationException("Source file missing for upload " + context.uploadId());
        }
        int slideCount = context.inputs().require(StepName.EXTRACT, SlideContents.class).slides().size();
        List<String> keys = rasterizers.call("all slides", rasterizer -> {
            List<String> images = rasterizer.rasterize(context.sourceFile(), slideCount, context.workKey("images/"));
            if (images.size() != slideCount) {
                throw new IllegalStateException("Expected " + slideCount + " images, got " + images.size());
            }
            return images;
        });
        List<SlideFile> files = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            files.add(new SlideFile(i + 1, keys.get(i)));
        }
        return new SlideFiles(files);
    }
}

package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.VisionAnalyzer;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class DummyVisionAnalyzer implements VisionAnalyzer {

    @Override
    public String name() {
        return "dummy-vision";
    }

    @Override
    public String analyze(Path image) throws Exception {
        return "Image " + image.getFileName() + " (" + Files.size(image) + " bytes) with no notable visual elements.";
    }
}

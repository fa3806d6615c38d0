package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.SlideRasterizer;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class DummySlideRasterizer implements SlideRasterizer {
    private final StorageService storageService;

    public DummySlideRasterizer(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public String name() {
        return "dummy-rasterizer";
    }

    @Override
    public List<String> rasterize(Path sourceFile, int slideCount, String keyPrefix) {
        List<String> keys = new ArrayList<>(slideCount);
        for (int i = 1; i <= slideCount; i++) {
            String key = keyPrefix + "slide_" + i + ".png";
            // fake png
            storageService.writeOut(key, ("slide " + i + " of " + sourceFile.getFileName()).getBytes(StandardCharsets.UTF_8));
            keys.add(key);
        }
        return keys;
    }
}

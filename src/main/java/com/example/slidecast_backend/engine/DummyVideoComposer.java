package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.VideoComposer;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class DummyVideoComposer implements VideoComposer {
    private final StorageService storageService;

    public DummyVideoComposer(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public String name() {
        return "dummy-composer";
    }

    @Override
    public void compose(List<Segment> segments, String objectKey) {
        String manifest = segments.stream()
                .map(s -> s.slideNumber() + ":" + s.mode() + ":" + s.durationMs())
                .collect(Collectors.joining("\n", "fake mp4\n", "\n"));
        storageService.writeOut(objectKey, manifest.getBytes(StandardCharsets.UTF_8));
    }
}

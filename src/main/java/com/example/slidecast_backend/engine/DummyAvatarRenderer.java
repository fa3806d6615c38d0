package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.AvatarRenderer;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Service
public class DummyAvatarRenderer implements AvatarRenderer {
    private final StorageService storageService;

    public DummyAvatarRenderer(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public String name() {
        return "dummy-avatar";
    }

    @Override
    public void render(String script, String audioKey, String objectKey) {
        storageService.writeOut(objectKey, ("fake mp4 avatar for " + audioKey).getBytes(StandardCharsets.UTF_8));
    }
}

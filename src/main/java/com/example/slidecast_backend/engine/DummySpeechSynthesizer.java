package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.SpeechSynthesizer;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Service
public class DummySpeechSynthesizer implements SpeechSynthesizer {
    static final long MS_PER_WORD = 400;

    private final StorageService storageService;

    public DummySpeechSynthesizer(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public String name() {
        return "dummy-tts";
    }

    @Override
    public long synthesize(String text, String language, String objectKey) {
        // simulate tts: placeholder mp3 with a duration derived from the word count
        storageService.writeOut(objectKey, ("fake mp3 [" + language + "] " + text).getBytes(StandardCharsets.UTF_8));
        long words = text.isBlank() ? 0 : text.trim().split("\\s+").length;
        return Math.max(1000, words * MS_PER_WORD);
    }
}

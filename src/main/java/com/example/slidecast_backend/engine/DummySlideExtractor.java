package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.engine.Interfaces.SlideExtractor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Treats the source as plain text with slides separated by a line containing only {@code ---}.
 */
@Service
public class DummySlideExtractor implements SlideExtractor {

    @Override
    public String name() {
        return "dummy-extractor";
    }

    @Override
    public List<String> extract(Path sourceFile) throws Exception {
        String text = Files.readString(sourceFile, StandardCharsets.UTF_8).replace("\r\n", "\n");
        return Arrays.stream(text.split("(?m)^---\\s*$"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}

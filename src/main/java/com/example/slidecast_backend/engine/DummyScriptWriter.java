package com.example.slidecast_backend.engine;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.engine.Interfaces.ScriptWriter;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the slide text back as narration. Review only normalizes whitespace.
 */
@Service
public class DummyScriptWriter implements ScriptWriter {

    @Override
    public String name() {
        return "dummy-writer";
    }

    @Override
    public String generate(int slideNumber, String slideText, String imageAnalysis, String language) {
        String text = slideText == null ? "" : slideText.replaceAll("\\s+", " ").trim();
        if (text.isEmpty()) {
            return "";
        }
        return text.endsWith(".") ? text : text + ".";
    }

    @Override
    public List<ScriptEntry> review(List<ScriptEntry> scripts, String language) {
        return scripts.stream()
                .map(s -> new ScriptEntry(s.slideNumber(), s.script() == null ? "" : s.script().replaceAll("\\s+", " ").trim()))
                .toList();
    }
}

package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.engine.Interfaces.SpeechSynthesizer;
import com.example.slidecast_backend.service.pipeline.FanOut;
import com.example.slidecast_backend.service.pipeline.FanOutResult;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Synthesizes one audio clip per slide with a non-empty script. Slides whose synthesis fails are left
 * without audio; the step only fails when no slide got any.
 */
@Component
public class GenerateAudioStep implements StepHandler<SlideFiles> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerateAudioStep.class);

    private final ProviderChain<SpeechSynthesizer> synthesizers;

    public GenerateAudioStep(List<SpeechSynthesizer> synthesizers) {
        this.synthesizers = new ProviderChain<>("speech synthesis", synthesizers);
    }

    @Override
    public StepName step() {
        return StepName.GENERATE_AUDIO;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.REVIEW_SCRIPTS);
    }

    @Override
    public SlideFiles execute(StepContext context) {
        ScriptSet scripts = context.inputs().require(StepName.REVIEW_SCRIPTS, ScriptSet.class);
        List<ScriptEntry> spoken = scripts.scripts().stream().filter(s -> !s.isBlank()).toList();
        if (spoken.size() < scripts.scripts().size()) {
            LOGGER.info("AUDIO skipping empty scripts uploadId={} skipped={}", context.uploadId(), scripts.scripts().size() - spoken.size());
        }

        FanOutResult<SlideFile> result = FanOut.run("audio " + context.uploadId(), spoken,
                entry -> "slide " + entry.slideNumber(),
                entry -> synthesize(context, scripts.language(), entry));
        List<SlideFile> files = result.successesOrThrow();
        LOGGER.info("AUDIO uploadId={} ok={} failed={}", context.uploadId(), files.size(), result.failures().size());
        return new SlideFiles(files);
    }

    private SlideFile synthesize(StepContext context, String language, ScriptEntry entry) {
        String key = context.workKey("audio/slide_" + entry.slideNumber() + ".mp3");
        long durationMs = synthesizers.call("slide " + entry.slideNumber(),
                tts -> tts.synthesize(entry.script(), language, key));
        return new SlideFile(entry.slideNumber(), key, durationMs);
    }
}

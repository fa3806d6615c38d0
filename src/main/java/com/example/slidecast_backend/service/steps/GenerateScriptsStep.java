package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ImageAnalyses;
import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideContents;
import com.example.slidecast_backend.engine.Interfaces.ScriptWriter;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes one narration script per slide. Registered twice: once for the audio language and once for
 * a separate subtitle language.
 */
public class GenerateScriptsStep implements StepHandler<ScriptSet> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerateScriptsStep.class);

    private final StepName step;
    private final Function<PipelineConfig, String> language;
    private final ProviderChain<ScriptWriter> writers;

    public GenerateScriptsStep(StepName step, Function<PipelineConfig, String> language, List<ScriptWriter> writers) {
        this.step = step;
        this.language = language;
        this.writers = new ProviderChain<>("script generation", writers);
    }

    @Override
    public StepName step() {
        return step;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.EXTRACT, StepName.ANALYZE_IMAGES);
    }

    @Override
    public ScriptSet execute(StepContext context) {
        List<String> slides = context.inputs().require(StepName.EXTRACT, SlideContents.class).slides();
        Optional<ImageAnalyses> analyses = context.inputs().find(StepName.ANALYZE_IMAGES, ImageAnalyses.class);
        String lang = language.apply(context.config());

        List<ScriptEntry> scripts = new ArrayList<>(slides.size());
        for (int i = 0; i < slides.size(); i++) {
            int slideNumber = i + 1;
            String text = slides.get(i);
            String analysis = analyses.flatMap(a -> a.forSlide(slideNumber)).orElse(null);
            String script = writers.call("slide " + slideNumber,
                    writer -> writer.generate(slideNumber, text, analysis, lang));
            scripts.add(new ScriptEntry(slideNumber, script == null ? "" : script.trim()));
        }
        LOGGER.info("SCRIPTS step={} uploadId={} language={} slides={}", step.key(), context.uploadId(), lang, scripts.size());
        return new ScriptSet(lang, scripts);
    }
}

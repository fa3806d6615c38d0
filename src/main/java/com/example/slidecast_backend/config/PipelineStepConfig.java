package com.example.slidecast_backend.config;

import com.example.slidecast_backend.engine.Interfaces.ScriptWriter;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.service.steps.GenerateScriptsStep;
import com.example.slidecast_backend.service.steps.ReviewScriptsStep;
import com.example.slidecast_backend.util.StepName;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Script steps exist once per language track, so they are declared here instead of by component scan.
 */
@Configuration
public class PipelineStepConfig {

    @Bean
    public GenerateScriptsStep generateScriptsStep(List<ScriptWriter> writers) {
        return new GenerateScriptsStep(StepName.GENERATE_SCRIPTS, PipelineConfig::audioLanguage, writers);
    }

    @Bean
    public ReviewScriptsStep reviewScriptsStep(List<ScriptWriter> writers) {
        return new ReviewScriptsStep(StepName.REVIEW_SCRIPTS, StepName.GENERATE_SCRIPTS, writers);
    }

    @Bean
    public GenerateScriptsStep generateSubtitleScriptsStep(List<ScriptWriter> writers) {
        return new GenerateScriptsStep(StepName.GENERATE_SUBTITLE_SCRIPTS, PipelineConfig::effectiveSubtitleLanguage, writers);
    }

    @Bean
    public ReviewScriptsStep reviewSubtitleScriptsStep(List<ScriptWriter> writers) {
        return new ReviewScriptsStep(StepName.REVIEW_SUBTITLE_SCRIPTS, StepName.GENERATE_SUBTITLE_SCRIPTS, writers);
    }
}

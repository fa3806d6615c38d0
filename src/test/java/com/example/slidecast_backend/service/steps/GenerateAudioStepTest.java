package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.engine.Interfaces.SpeechSynthesizer;
import com.example.slidecast_backend.exception.FanOutFailedException;
import com.example.slidecast_backend.exception.StepValidationException;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.support.StepContexts;
import com.example.slidecast_backend.util.StepName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerateAudioStepTest {

    /** Fails for the configured slide numbers, recognised by the key it is asked to write. */
    static class ScriptedSynthesizer implements SpeechSynthesizer {
        private final String name;
        private final Set<Integer> failingSlides;
        final List<String> writtenKeys = new ArrayList<>();

        ScriptedSynthesizer(String name, Set<Integer> failingSlides) {
            this.name = name;
            this.failingSlides = failingSlides;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public long synthesize(String text, String language, String objectKey) {
            for (Integer slide : failingSlides) {
                if (objectKey.endsWith("slide_" + slide + ".mp3")) {
                    throw new IllegalStateException(name + " rejected slide " + slide);
                }
            }
            writtenKeys.add(objectKey);
            return 1000L * text.length();
        }
    }

    private static ScriptSet scripts(int count) {
        List<ScriptEntry> entries = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            entries.add(new ScriptEntry(i, "Slide " + i));
        }
        return new ScriptSet("english", entries);
    }

    private SlideFiles run(GenerateAudioStep step, ScriptSet scripts) {
        return step.execute(StepContexts.forHandler(step, PipelineConfig.defaults(), Map.of(StepName.REVIEW_SCRIPTS, scripts)));
    }

    @Test
    void partialFailureCompletesWithSuccessfulSlides() {
        GenerateAudioStep step = new GenerateAudioStep(List.of(new ScriptedSynthesizer("tts", Set.of(2, 4))));

        SlideFiles audio = run(step, scripts(5));

        assertThat(audio.files()).extracting(SlideFile::slideNumber).containsExactly(1, 3, 5);
        assertThat(audio.files().get(0).objectKey()).isEqualTo("uploads/u1/work/audio/slide_1.mp3");
        assertThat(audio.files().get(0).durationMs()).isEqualTo(7000L);
    }

    @Test
    void everySlideFailingFailsTheStep() {
        GenerateAudioStep step = new GenerateAudioStep(List.of(new ScriptedSynthesizer("tts", Set.of(1, 2, 3, 4, 5))));

        assertThatThrownBy(() -> run(step, scripts(5)))
                .isInstanceOf(FanOutFailedException.class)
                .hasMessageContaining("all 5 items");
    }

    @Test
    void fallbackProviderCoversPrimaryFailures() {
        ScriptedSynthesizer fallback = new ScriptedSynthesizer("fallback", Set.of());
        GenerateAudioStep step = new GenerateAudioStep(List.of(new ScriptedSynthesizer("primary", Set.of(2)), fallback));

        SlideFiles audio = run(step, scripts(3));

        assertThat(audio.files()).hasSize(3);
        assertThat(fallback.writtenKeys).containsExactly("uploads/u1/work/audio/slide_2.mp3");
    }

    @Test
    void blankScriptsAreSkipped() {
        ScriptSet scripts = new ScriptSet("english", List.of(
                new ScriptEntry(1, "Hello"), new ScriptEntry(2, "   "), new ScriptEntry(3, "World")));
        GenerateAudioStep step = new GenerateAudioStep(List.of(new ScriptedSynthesizer("tts", Set.of())));

        SlideFiles audio = run(step, scripts);

        assertThat(audio.files()).extracting(SlideFile::slideNumber).containsExactly(1, 3);
    }

    @Test
    void missingScriptsIsAValidationError() {
        GenerateAudioStep step = new GenerateAudioStep(List.of(new ScriptedSynthesizer("tts", Set.of())));

        assertThatThrownBy(() -> step.execute(StepContexts.forHandler(step, PipelineConfig.defaults(), Map.of())))
                .isInstanceOf(StepValidationException.class)
                .hasMessageContaining("review_scripts");
    }
}

package com.example.slidecast_backend.service;

import com.example.slidecast_backend.dto.pipeline.ComposedVideo;
import com.example.slidecast_backend.dto.pipeline.SlideComposition;
import com.example.slidecast_backend.engine.DummyAvatarRenderer;
import com.example.slidecast_backend.engine.DummyScriptWriter;
import com.example.slidecast_backend.engine.DummySlideExtractor;
import com.example.slidecast_backend.engine.DummySlideRasterizer;
import com.example.slidecast_backend.engine.DummySpeechSynthesizer;
import com.example.slidecast_backend.engine.DummyVideoComposer;
import com.example.slidecast_backend.engine.DummyVisionAnalyzer;
import com.example.slidecast_backend.engine.Interfaces.ScriptWriter;
import com.example.slidecast_backend.engine.Interfaces.SlideExtractor;
import com.example.slidecast_backend.engine.Interfaces.SpeechSynthesizer;
import com.example.slidecast_backend.engine.Interfaces.VideoComposer;
import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.model.UploadState;
import com.example.slidecast_backend.service.pipeline.PipelineOutcome;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.service.pipeline.StepHandlerRegistry;
import com.example.slidecast_backend.service.pipeline.StepPayloadCodec;
import com.example.slidecast_backend.service.steps.AnalyzeImagesStep;
import com.example.slidecast_backend.service.steps.ComposeVideoStep;
import com.example.slidecast_backend.service.steps.ConvertSlidesStep;
import com.example.slidecast_backend.service.steps.ExtractSlidesStep;
import com.example.slidecast_backend.service.steps.GenerateAudioStep;
import com.example.slidecast_backend.service.steps.GenerateAvatarVideosStep;
import com.example.slidecast_backend.service.steps.GenerateScriptsStep;
import com.example.slidecast_backend.service.steps.ReviewScriptsStep;
import com.example.slidecast_backend.support.InMemoryStores;
import com.example.slidecast_backend.support.TestJson;
import com.example.slidecast_backend.util.CompositionMode;
import com.example.slidecast_backend.util.StepName;
import com.example.slidecast_backend.util.StepStatus;
import com.example.slidecast_backend.util.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the real step handlers against the placeholder engines, local storage and in-memory stores.
 */
class PipelineEndToEndTest {

    @TempDir
    Path baseDir;

    private InMemoryStores stores;
    private LocalStorageService storage;
    private StepPayloadCodec codec;
    private Path source;

    private final AtomicInteger extractCalls = new AtomicInteger();
    private final AtomicInteger composeFailuresLeft = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        stores = new InMemoryStores();
        storage = new LocalStorageService(baseDir, "raw", "out");
        codec = new StepPayloadCodec(TestJson.mapper());
        source = storage.resolveRaw("decks/u1.txt");
        Files.createDirectories(source.getParent());
        Files.writeString(source, "Welcome to the quarterly review\n---\nRevenue grew in every region\n", StandardCharsets.UTF_8);
    }

    @Test
    void slideWithoutAudioFallsBackToImageOnly() throws Exception {
        PipelineOutcome outcome = orchestrator().run("u1", null, PipelineConfig.defaults(), source);

        assertThat(outcome.status()).isEqualTo(PipelineOutcome.Status.COMPLETED);
        UploadState state = stores.states.getState("u1").orElseThrow();
        assertThat(state.getStatus()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(state.getSteps().values()).allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(StepStatus.COMPLETED));

        ComposedVideo video = codec.decode(StepName.COMPOSE, state.step(StepName.COMPOSE).orElseThrow().getData(), ComposedVideo.class);
        assertThat(video.slides()).extracting(SlideComposition::mode)
                .containsExactly(CompositionMode.AUDIO_AND_IMAGE, CompositionMode.IMAGE_ONLY);
        assertThat(storage.existsInOut(video.videoKey())).isTrue();
        assertThat(Files.readString(storage.resolveOut(video.videoKey()))).contains("2:IMAGE_ONLY:5000");
        assertThat(storage.existsInOut(video.subtitles().srtKey())).isTrue();
        assertThat(storage.existsInOut(video.subtitles().vttKey())).isTrue();
        assertThat(Files.exists(storage.resolveOut("uploads/u1/work"))).isFalse();
    }

    @Test
    void rerunAfterFailureResumesAtTheFailedStep() {
        composeFailuresLeft.set(1);
        PipelineOrchestrator orchestrator = orchestrator();

        PipelineOutcome first = orchestrator.run("u1", null, PipelineConfig.defaults(), source);

        assertThat(first.status()).isEqualTo(PipelineOutcome.Status.FAILED);
        assertThat(first.failedStep()).isEqualTo(StepName.COMPOSE.key());
        UploadState failed = stores.states.getState("u1").orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(failed.step(StepName.GENERATE_AUDIO).orElseThrow().getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(storage.existsInOut("uploads/u1/work/audio/slide_1.mp3")).isTrue();

        PipelineOutcome second = orchestrator.run("u1", null, PipelineConfig.defaults(), source);

        assertThat(second.status()).isEqualTo(PipelineOutcome.Status.COMPLETED);
        assertThat(extractCalls).hasValue(1);
        assertThat(stores.states.getState("u1").orElseThrow().getErrors()).hasSize(1);
    }

    private PipelineOrchestrator orchestrator() {
        SlideExtractor extractor = new SlideExtractor() {
            private final DummySlideExtractor delegate = new DummySlideExtractor();

            @Override
            public String name() {
                return "counting";
            }

            @Override
            public List<String> extract(Path sourceFile) throws Exception {
                extractCalls.incrementAndGet();
                return delegate.extract(sourceFile);
            }
        };
        SpeechSynthesizer speech = new SpeechSynthesizer() {
            private final DummySpeechSynthesizer delegate = new DummySpeechSynthesizer(storage);

            @Override
            public String name() {
                return "second-slide-down";
            }

            @Override
            public long synthesize(String text, String language, String objectKey) {
                if (objectKey.endsWith("slide_2.mp3")) {
                    throw new IllegalStateException("voice unavailable");
                }
                return delegate.synthesize(text, language, objectKey);
            }
        };
        VideoComposer composer = new VideoComposer() {
            private final DummyVideoComposer delegate = new DummyVideoComposer(storage);

            @Override
            public String name() {
                return "flaky-composer";
            }

            @Override
            public void compose(List<Segment> segments, String objectKey) {
                if (composeFailuresLeft.getAndDecrement() > 0) {
                    throw new IllegalStateException("encoder crashed");
                }
                delegate.compose(segments, objectKey);
            }
        };
        List<ScriptWriter> writers = List.of(new DummyScriptWriter());

        List<StepHandler<?>> handlers = List.of(
                new ExtractSlidesStep(List.of(extractor)),
                new ConvertSlidesStep(List.of(new DummySlideRasterizer(storage))),
                new AnalyzeImagesStep(List.of(new DummyVisionAnalyzer()), storage),
                new GenerateScriptsStep(StepName.GENERATE_SCRIPTS, PipelineConfig::audioLanguage, writers),
                new ReviewScriptsStep(StepName.REVIEW_SCRIPTS, StepName.GENERATE_SCRIPTS, writers),
                new GenerateScriptsStep(StepName.GENERATE_SUBTITLE_SCRIPTS, PipelineConfig::effectiveSubtitleLanguage, writers),
                new ReviewScriptsStep(StepName.REVIEW_SUBTITLE_SCRIPTS, StepName.GENERATE_SUBTITLE_SCRIPTS, writers),
                new GenerateAudioStep(List.of(speech)),
                new GenerateAvatarVideosStep(List.of(new DummyAvatarRenderer(storage))),
                new ComposeVideoStep(List.of(composer), new SubtitleServiceImpl(storage)));

        return new PipelineOrchestrator(stores.states, stores.queue, new StepHandlerRegistry(handlers), codec,
                new MediaCleanupService(storage, stores.properties));
    }
}

package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ComposedVideo;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideComposition;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.dto.pipeline.SubtitleFiles;
import com.example.slidecast_backend.engine.Interfaces.VideoComposer;
import com.example.slidecast_backend.engine.Interfaces.VideoComposer.Segment;
import com.example.slidecast_backend.service.Interfaces.SubtitleService;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.CompositionMode;
import com.example.slidecast_backend.util.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles the final video slide by slide. Each slide uses the richest media it has:
 * avatar with audio, then audio over the slide image, then the image alone.
 */
@Component
public class ComposeVideoStep implements StepHandler<ComposedVideo> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComposeVideoStep.class);
    static final long IMAGE_ONLY_DURATION_MS = 5_000L;

    private final ProviderChain<VideoComposer> composers;
    private final SubtitleService subtitleService;

    public ComposeVideoStep(List<VideoComposer> composers, SubtitleService subtitleService) {
        this.composers = new ProviderChain<>("video composition", composers);
        this.subtitleService = subtitleService;
    }

    @Override
    public StepName step() {
        return StepName.COMPOSE;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.CONVERT_TO_IMAGES, StepName.REVIEW_SCRIPTS, StepName.GENERATE_AUDIO,
                StepName.GENERATE_AVATAR_VIDEOS, StepName.REVIEW_SUBTITLE_SCRIPTS);
    }

    @Override
    public ComposedVideo execute(StepContext context) {
        SlideFiles images = context.inputs().require(StepName.CONVERT_TO_IMAGES, SlideFiles.class);
        ScriptSet scripts = context.inputs().require(StepName.REVIEW_SCRIPTS, ScriptSet.class);
        SlideFiles audio = context.inputs().find(StepName.GENERATE_AUDIO, SlideFiles.class).orElse(new SlideFiles(List.of()));
        SlideFiles avatars = context.config().generateAvatar()
                ? context.inputs().find(StepName.GENERATE_AVATAR_VIDEOS, SlideFiles.class).orElse(new SlideFiles(List.of()))
                : new SlideFiles(List.of());

        List<Segment> segments = new ArrayList<>(images.files().size());
        List<SlideComposition> compositions = new ArrayList<>(images.files().size());
        List<SlideFile> timeline = new ArrayList<>(images.files().size());
        for (SlideFile image : images.files()) {
            Segment segment = segmentFor(image, audio.forSlide(image.slideNumber()), avatars.forSlide(image.slideNumber()));
            segments.add(segment);
            compositions.add(new SlideComposition(segment.slideNumber(), segment.mode()));
            timeline.add(new SlideFile(segment.slideNumber(), image.objectKey(), segment.durationMs()));
            if (segment.mode() != CompositionMode.AVATAR_AND_AUDIO && context.config().generateAvatar()) {
                LOGGER.info("COMPOSE degraded uploadId={} slide={} mode={}", context.uploadId(), segment.slideNumber(), segment.mode());
            }
        }

        String videoKey = context.outputKey("presentation.mp4");
        composers.call(videoKey, composer -> {
            composer.compose(segments, videoKey);
            return videoKey;
        });

        SubtitleFiles subtitles = null;
        if (context.config().generateSubtitles()) {
            ScriptSet subtitleScripts = context.inputs().find(StepName.REVIEW_SUBTITLE_SCRIPTS, ScriptSet.class).orElse(scripts);
            subtitles = subtitleService.writeSubtitles(context.outputKey(""), subtitleScripts, new SlideFiles(timeline));
        }
        LOGGER.info("COMPOSE done uploadId={} video={} slides={} subtitles={}", context.uploadId(), videoKey,
                segments.size(), subtitles != null);
        return new ComposedVideo(videoKey, subtitles, compositions);
    }

    private static Segment segmentFor(SlideFile image, Optional<SlideFile> audio, Optional<SlideFile> avatar) {
        if (audio.isPresent() && avatar.isPresent()) {
            return new Segment(image.slideNumber(), CompositionMode.AVATAR_AND_AUDIO, image.objectKey(),
                    audio.get().objectKey(), avatar.get().objectKey(), durationOf(audio.get()));
        }
        if (audio.isPresent()) {
            return new Segment(image.slideNumber(), CompositionMode.AUDIO_AND_IMAGE, image.objectKey(),
                    audio.get().objectKey(), null, durationOf(audio.get()));
        }
        return new Segment(image.slideNumber(), CompositionMode.IMAGE_ONLY, image.objectKey(), null, null, IMAGE_ONLY_DURATION_MS);
    }

    private static long durationOf(SlideFile audio) {
        return audio.durationMs() == null ? IMAGE_ONLY_DURATION_MS : audio.durationMs();
    }
}

package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.engine.Interfaces.AvatarRenderer;
import com.example.slidecast_backend.service.pipeline.FanOut;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Renders a presenter clip for every slide that has audio. Missing clips fall back to audio plus image at compose time.
 */
@Component
public class GenerateAvatarVideosStep implements StepHandler<SlideFiles> {
    private final ProviderChain<AvatarRenderer> renderers;

    public GenerateAvatarVideosStep(List<AvatarRenderer> renderers) {
        this.renderers = new ProviderChain<>("avatar rendering", renderers);
    }

    @Override
    public StepName step() {
        return StepName.GENERATE_AVATAR_VIDEOS;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(StepName.REVIEW_SCRIPTS, StepName.GENERATE_AUDIO);
    }

    @Override
    public SlideFiles execute(StepContext context) {
        ScriptSet scripts = context.inputs().require(StepName.REVIEW_SCRIPTS, ScriptSet.class);
        SlideFiles audio = context.inputs().require(StepName.GENERATE_AUDIO, SlideFiles.class);
        List<SlideFile> clips = FanOut.run("avatar " + context.uploadId(), audio.files(),
                        clip -> "slide " + clip.slideNumber(),
                        clip -> render(context, scripts, clip))
                .successesOrThrow();
        return new SlideFiles(clips);
    }

    private SlideFile render(StepContext context, ScriptSet scripts, SlideFile audio) {
        String script = scripts.forSlide(audio.slideNumber()).map(ScriptEntry::script).orElse("");
        String key = context.workKey("avatar/slide_" + audio.slideNumber() + ".mp4");
        renderers.call("slide " + audio.slideNumber(), renderer -> {
            renderer.render(script, audio.objectKey(), key);
            return key;
        });
        return new SlideFile(audio.slideNumber(), key, audio.durationMs());
    }
}

package com.example.slidecast_backend.service.pipeline;

import com.example.slidecast_backend.model.PipelineConfig;
import com.example.slidecast_backend.util.StepName;

import java.util.ArrayList;
import java.util.List;

import static com.example.slidecast_backend.util.StepName.*;

/**
 * Derives the ordered step list of a run from its configuration.
 */
public final class StepOrderPlanner {

    private StepOrderPlanner() {}

    public static List<StepName> compute(PipelineConfig config) {
        List<StepName> order = new ArrayList<>(List.of(
                EXTRACT, CONVERT_TO_IMAGES, ANALYZE_IMAGES, GENERATE_SCRIPTS, REVIEW_SCRIPTS));
        if (config.hasSeparateSubtitleLanguage()) {
            order.add(GENERATE_SUBTITLE_SCRIPTS);
            order.add(REVIEW_SUBTITLE_SCRIPTS);
        }
        order.add(GENERATE_AUDIO);
        if (config.generateAvatar()) {
            order.add(GENERATE_AVATAR_VIDEOS);
        }
        order.add(COMPOSE);
        return List.copyOf(order);
    }
}

package com.example.slidecast_backend.service.steps;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.engine.Interfaces.ScriptWriter;
import com.example.slidecast_backend.service.pipeline.ProviderChain;
import com.example.slidecast_backend.service.pipeline.StepContext;
import com.example.slidecast_backend.service.pipeline.StepHandler;
import com.example.slidecast_backend.util.StepName;

import java.util.List;
import java.util.Set;

/**
 * Reviews the full script set of {@code source} in one call so the narration reads consistently.
 */
public class ReviewScriptsStep implements StepHandler<ScriptSet> {
    private final StepName step;
    private final StepName source;
    private final ProviderChain<ScriptWriter> writers;

    public ReviewScriptsStep(StepName step, StepName source, List<ScriptWriter> writers) {
        this.step = step;
        this.source = source;
        this.writers = new ProviderChain<>("script review", writers);
    }

    @Override
    public StepName step() {
        return step;
    }

    @Override
    public Set<StepName> inputs() {
        return Set.of(source);
    }

    @Override
    public ScriptSet execute(StepContext context) {
        ScriptSet draft = context.inputs().require(source, ScriptSet.class);
        List<ScriptEntry> reviewed = writers.call(draft.language() + " scripts", writer -> {
            List<ScriptEntry> result = writer.review(draft.scripts(), draft.language());
            if (result == null || result.size() != draft.scripts().size()) {
                throw new IllegalStateException("Review returned " + (result == null ? 0 : result.size())
                        + " scripts for " + draft.scripts().size() + " slides");
            }
            return result;
        });
        return new ScriptSet(draft.language(), reviewed);
    }
}

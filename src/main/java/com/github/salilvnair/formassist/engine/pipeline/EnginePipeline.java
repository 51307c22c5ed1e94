package com.github.salilvnair.formassist.engine.pipeline;

import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.session.TurnSession;

import java.util.List;

public final class EnginePipeline {

    private final List<EngineStep> steps;

    public EnginePipeline(List<EngineStep> steps) {
        this.steps = steps;
    }

    public void execute(TurnSession session) {
        for (EngineStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop) {
                break;
            }
        }
        // every usable turn answers the user at least once
        if (session.getReplies().isEmpty()) {
            throw new FormEngineException(FormEngineErrorCode.PIPELINE_NO_REPLY);
        }
    }

    public List<EngineStep> steps() {
        return steps;
    }
}

package com.github.salilvnair.formassist.engine.pipeline;

import com.github.salilvnair.formassist.engine.session.TurnSession;

public interface EngineStep {
    StepResult execute(TurnSession session);
}

package com.github.salilvnair.formassist.engine.pipeline;

public sealed interface StepResult permits StepResult.Continue, StepResult.Stop {

    record Continue() implements StepResult {}
    record Stop(String reason) implements StepResult {}
}

package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.engine.helper.FieldProgressionHelper;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.extraction.IntentType;
import com.github.salilvnair.formassist.guidance.ReplyPhrases;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Catch-all for turns no other branch answered. Counters stay untouched.
 */
@Component
@RequiredArgsConstructor
@MustRunAfter({ProvideValueStep.class, HelpRequestStep.class, SkipRequestStep.class})
public class UnrecognizedInputStep implements EngineStep {

    private final FieldProgressionHelper progression;

    @Override
    public StepResult execute(TurnSession session) {
        if (session.isHandled()) {
            return new StepResult.Continue();
        }
        session.reply(ReplyPhrases.notUnderstood(progression.currentField(session).label()));
        session.markHandled(IntentType.OTHER);
        return new StepResult.Continue();
    }
}

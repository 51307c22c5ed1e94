package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.guidance.ReplyPhrases;
import org.springframework.stereotype.Component;

/**
 * A finished form takes no further values until the session is reset.
 */
@Component
@MustRunAfter(RecordUserInputStep.class)
public class CompletedFormStep implements EngineStep {

    @Override
    public StepResult execute(TurnSession session) {
        if (!session.isComplete()) {
            return new StepResult.Continue();
        }
        session.reply(ReplyPhrases.ALREADY_COMPLETE);
        session.markHandled(null);
        return new StepResult.Stop("FORM_ALREADY_COMPLETE");
    }
}

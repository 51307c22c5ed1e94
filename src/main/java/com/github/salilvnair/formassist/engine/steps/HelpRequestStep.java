package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.engine.helper.FieldProgressionHelper;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.extraction.ExtractedIntent;
import com.github.salilvnair.formassist.extraction.IntentType;
import com.github.salilvnair.formassist.guidance.GuidanceComposer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@MustRunAfter(ConfirmationStep.class)
public class HelpRequestStep implements EngineStep {

    private final GuidanceComposer guidanceComposer;
    private final FieldProgressionHelper progression;

    @Override
    public StepResult execute(TurnSession session) {
        ExtractedIntent intent = session.getExtractedIntent();
        if (session.isHandled() || intent == null || !intent.is(IntentType.REQUEST_HELP)) {
            return new StepResult.Continue();
        }
        session.reply(guidanceComposer.composeHelp(progression.currentField(session)));
        session.markHandled(IntentType.REQUEST_HELP);
        return new StepResult.Continue();
    }
}

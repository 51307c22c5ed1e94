package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.helper.FieldProgressionHelper;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.extraction.ExtractedIntent;
import com.github.salilvnair.formassist.extraction.IntentType;
import com.github.salilvnair.formassist.guidance.ReplyPhrases;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Optional fields may be skipped and are stored as null; required fields stay put.
 */
@Component
@RequiredArgsConstructor
@MustRunAfter(ConfirmationStep.class)
public class SkipRequestStep implements EngineStep {

    private final FieldProgressionHelper progression;
    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        ExtractedIntent intent = session.getExtractedIntent();
        if (session.isHandled() || intent == null || !intent.is(IntentType.REQUEST_SKIP)) {
            return new StepResult.Continue();
        }
        FormFieldSpec field = progression.currentField(session);
        if (field.required()) {
            session.reply(ReplyPhrases.cannotSkip(field.label()));
            audit.audit(FormAuditStage.SKIP_REJECTED, session.getSessionId(), Map.of(FormPayloadKey.FIELD, field.name()));
        } else {
            session.commitValue(field.name(), null);
            session.reply(ReplyPhrases.skipped(field.label()));
            audit.audit(FormAuditStage.FIELD_SKIPPED, session.getSessionId(), Map.of(FormPayloadKey.FIELD, field.name()));
            progression.advance(session);
        }
        session.markHandled(IntentType.REQUEST_SKIP);
        return new StepResult.Continue();
    }
}

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
import com.github.salilvnair.formassist.guidance.GuidanceComposer;
import com.github.salilvnair.formassist.guidance.ReplyPhrases;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.validation.FieldValidator;
import com.github.salilvnair.formassist.validation.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves a pending value. Anything other than a confirmation counts as a denial.
 */
@Component
@RequiredArgsConstructor
@MustRunAfter(IntentExtractionStep.class)
public class ConfirmationStep implements EngineStep {

    private final FieldValidator fieldValidator;
    private final GuidanceComposer guidanceComposer;
    private final FieldProgressionHelper progression;
    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        if (!session.isConfirmationPending()) {
            return new StepResult.Continue();
        }
        FormFieldSpec field = progression.currentField(session);
        ExtractedIntent intent = session.getExtractedIntent();
        if (intent != null && intent.is(IntentType.CONFIRM)) {
            confirm(session, field);
            session.markHandled(IntentType.CONFIRM);
        } else {
            deny(session, field);
            session.markHandled(IntentType.DENY);
        }
        return new StepResult.Continue();
    }

    private void confirm(TurnSession session, FormFieldSpec field) {
        Object pending = fieldValidator.coerce(field, session.getPendingValue());
        ValidationOutcome outcome = fieldValidator.validate(field, pending, session.getFieldValues());
        session.setValidationOutcome(outcome);
        if (!outcome.valid()) {
            session.clearPending();
            session.incrementAttempts();
            session.reply(guidanceComposer.compose(field, outcome, session.getExtractionAttempts()));
            audit.audit(FormAuditStage.VALUE_VALIDATED, session.getSessionId(), validationPayload(field, outcome, session));
            return;
        }
        session.commitValue(field.name(), outcome.value());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.FIELD, field.name());
        payload.put(FormPayloadKey.VALUE, outcome.value());
        audit.audit(FormAuditStage.VALUE_CONFIRMED, session.getSessionId(), payload);
        session.reply(ReplyPhrases.saved(field.label(), guidanceComposer.renderValue(outcome.value())));
        progression.advance(session);
    }

    private void deny(TurnSession session, FormFieldSpec field) {
        Object rejected = session.getPendingValue();
        session.clearPending();
        session.setExtractionAttempts(0);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.FIELD, field.name());
        payload.put(FormPayloadKey.VALUE, rejected);
        audit.audit(FormAuditStage.VALUE_DENIED, session.getSessionId(), payload);
        session.reply(ReplyPhrases.reAsk(field.label()));
    }

    private Map<String, Object> validationPayload(FormFieldSpec field, ValidationOutcome outcome, TurnSession session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.FIELD, field.name());
        payload.put(FormPayloadKey.VALUE, outcome.value());
        payload.put(FormPayloadKey.VALID, outcome.valid());
        payload.put(FormPayloadKey.ERROR, outcome.errorMessage());
        payload.put(FormPayloadKey.ATTEMPTS, session.getExtractionAttempts());
        return payload;
    }
}

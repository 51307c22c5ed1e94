package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.config.FormAssistFlowConfig;
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

@Component
@RequiredArgsConstructor
@MustRunAfter(ConfirmationStep.class)
public class ProvideValueStep implements EngineStep {

    private final FieldValidator fieldValidator;
    private final GuidanceComposer guidanceComposer;
    private final FieldProgressionHelper progression;
    private final FormAssistFlowConfig flowConfig;
    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        ExtractedIntent intent = session.getExtractedIntent();
        if (session.isHandled() || intent == null || !intent.is(IntentType.PROVIDE_VALUE)) {
            return new StepResult.Continue();
        }
        // low-confidence extractions are left to UnrecognizedInputStep
        if (intent.confidence() < flowConfig.getMinConfidence()) {
            return new StepResult.Continue();
        }
        FormFieldSpec field = progression.currentField(session);
        ValidationOutcome outcome = fieldValidator.validate(field, intent.value(), session.getFieldValues());
        session.setValidationOutcome(outcome);
        if (outcome.valid()) {
            session.holdForConfirmation(outcome.value());
            session.reply(ReplyPhrases.confirmPrompt(field.label(), guidanceComposer.renderValue(outcome.value())));
        } else {
            session.incrementAttempts();
            session.reply(guidanceComposer.compose(field, outcome, session.getExtractionAttempts()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.FIELD, field.name());
        payload.put(FormPayloadKey.VALUE, outcome.value());
        payload.put(FormPayloadKey.VALID, outcome.valid());
        payload.put(FormPayloadKey.ERROR, outcome.errorMessage());
        payload.put(FormPayloadKey.ATTEMPTS, session.getExtractionAttempts());
        audit.audit(FormAuditStage.VALUE_VALIDATED, session.getSessionId(), payload);

        session.markHandled(IntentType.PROVIDE_VALUE);
        return new StepResult.Continue();
    }
}

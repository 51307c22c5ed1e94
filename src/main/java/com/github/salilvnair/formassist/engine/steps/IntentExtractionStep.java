package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.config.FormAssistFlowConfig;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.helper.FieldProgressionHelper;
import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.extraction.ExtractedIntent;
import com.github.salilvnair.formassist.extraction.ExtractionRequest;
import com.github.salilvnair.formassist.extraction.ExtractionService;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
@MustRunAfter(CompletedFormStep.class)
public class IntentExtractionStep implements EngineStep {

    private final ExtractionService extractionService;
    private final FieldProgressionHelper progression;
    private final FormAssistFlowConfig flowConfig;
    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        FormFieldSpec field = progression.currentField(session);
        ExtractionRequest request = new ExtractionRequest(
                session.getUserText(),
                field,
                historyBeforeCurrentInput(session),
                session.getPendingValue(),
                session.isConfirmationPending()
        );
        ExtractedIntent intent = extractionService.extract(request);
        session.setExtractedIntent(intent);
        log.debug("Extracted intent {} (confidence {}) for field {}", intent.intent(), intent.confidence(), field.name());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.FIELD, field.name());
        payload.put(FormPayloadKey.INTENT, intent.intent() == null ? null : intent.intent().code());
        payload.put(FormPayloadKey.VALUE, intent.value());
        payload.put(FormPayloadKey.CONFIDENCE, intent.confidence());
        payload.put(FormPayloadKey.SOURCE, intent.source());
        payload.put(FormPayloadKey.REASONING, intent.reasoning());
        audit.audit(FormAuditStage.INTENT_EXTRACTED, session.getSessionId(), payload);
        return new StepResult.Continue();
    }

    private List<ConversationMessage> historyBeforeCurrentInput(TurnSession session) {
        List<ConversationMessage> window = session.lastMessages(flowConfig.getHistoryTurns() + 1);
        if (window.isEmpty()) {
            return window;
        }
        // the newest entry is the input being extracted; it is sent separately
        return window.subList(0, window.size() - 1);
    }
}

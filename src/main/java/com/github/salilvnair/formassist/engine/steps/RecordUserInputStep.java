package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RecordUserInputStep implements EngineStep {

    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        session.recordUserInput();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.USER_TEXT, session.getUserText());
        payload.put(FormPayloadKey.FIELD, session.getCurrentField());
        payload.put(FormPayloadKey.CONFIRMATION_PENDING, session.isConfirmationPending());
        audit.audit(FormAuditStage.USER_INPUT, session.getSessionId(), payload);
        return new StepResult.Continue();
    }
}

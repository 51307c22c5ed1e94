package com.github.salilvnair.formassist.engine.provider;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.core.FormConversationEngine;
import com.github.salilvnair.formassist.engine.factory.EnginePipelineFactory;
import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.TurnResult;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.guidance.GuidanceComposer;
import com.github.salilvnair.formassist.guidance.ReplyPhrases;
import com.github.salilvnair.formassist.schema.FormSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultFormConversationEngine implements FormConversationEngine {

    static final String EMPTY_INPUT = "No input received";

    private final EnginePipelineFactory pipelineFactory;
    private final FormSchema formSchema;
    private final GuidanceComposer guidanceComposer;
    private final AuditService audit;

    @Override
    public SessionState start(String sessionId) {
        SessionState state = SessionState.initial(
                sessionId,
                formSchema.firstField().name(),
                guidanceComposer.composeGreeting(formSchema.firstField())
        );
        audit.audit(FormAuditStage.SESSION_STARTED, sessionId, Map.of(FormPayloadKey.FIELD, state.getCurrentField()));
        return state;
    }

    @Override
    public TurnResult advance(SessionState state, String userText) {
        if (userText == null || userText.isBlank()) {
            audit.audit(FormAuditStage.INPUT_UNUSABLE, state.getSessionId(), Map.of(FormPayloadKey.ERROR, EMPTY_INPUT));
            return TurnResult.unusable(state, EMPTY_INPUT);
        }
        String text = userText.trim();
        TurnSession session = new TurnSession(state, text);
        try {
            pipelineFactory.create().execute(session);
            return session.toTurnResult();
        } catch (RuntimeException e) {
            // the working copy is discarded; only the user entry and an apology survive
            log.error("Turn failed for session {}: {}", state.getSessionId(), e.getMessage(), e);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(FormPayloadKey.FIELD, state.getCurrentField());
            payload.put("errorType", e.getClass().getSimpleName());
            payload.put("errorMessage", String.valueOf(e.getMessage()));
            audit.audit(FormAuditStage.TURN_FAILED, state.getSessionId(), payload);
            SessionState recovered = state.withMessages(List.of(
                    ConversationMessage.user(text),
                    ConversationMessage.assistant(ReplyPhrases.TROUBLE_PROCESSING)
            ));
            return new TurnResult(recovered, true, List.of(ReplyPhrases.TROUBLE_PROCESSING), null, null);
        }
    }
}

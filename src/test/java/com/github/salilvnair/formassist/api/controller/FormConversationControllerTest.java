package com.github.salilvnair.formassist.api.controller;

import com.github.salilvnair.formassist.api.dto.CaptureRequest;
import com.github.salilvnair.formassist.api.dto.FormConversationResponse;
import com.github.salilvnair.formassist.api.dto.FormMessageRequest;
import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.TurnResult;
import com.github.salilvnair.formassist.extraction.IntentType;
import com.github.salilvnair.formassist.schema.FormSchemaDefinition;
import com.github.salilvnair.formassist.service.FormConversationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.formassist.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormConversationControllerTest {

    @Mock
    private FormConversationService conversationService;
    @Mock
    private AuditService audit;
    @InjectMocks
    private FormConversationController controller;

    @Test
    void startReturnsGreeting() {
        when(conversationService.start())
                .thenReturn(SessionState.initial(SESSION_ID, FormSchemaDefinition.FULL_NAME, "Hello!"));

        FormConversationResponse response = controller.start();

        assertTrue(response.isSuccess());
        assertEquals(SESSION_ID, response.getSessionId());
        assertEquals(FormSchemaDefinition.FULL_NAME, response.getCurrentField());
        assertEquals(List.of("Hello!"), response.getReplies());
    }

    @Test
    void messageMapsTurnResult() {
        SessionState state = SessionState.initial(SESSION_ID, FormSchemaDefinition.FULL_NAME, "Hello!");
        when(conversationService.processText(SESSION_ID, USER_TEXT_HELP))
                .thenReturn(new TurnResult(state, true, List.of("help text"), IntentType.REQUEST_HELP, null));
        FormMessageRequest request = new FormMessageRequest();
        request.setMessage(USER_TEXT_HELP);

        FormConversationResponse response = controller.message(SESSION_ID, request);

        assertTrue(response.isSuccess());
        assertTrue(response.isUsable());
        assertEquals("request_help", response.getIntent());
        assertEquals(List.of("help text"), response.getReplies());
    }

    @Test
    void failedCaptureIsReportedAsUnusable() {
        SessionState state = SessionState.initial(SESSION_ID, FormSchemaDefinition.FULL_NAME, "Hello!");
        when(conversationService.processCapture(eq(SESSION_ID), argThat(c -> !c.success())))
                .thenReturn(TurnResult.unusable(state, "No input received"));
        CaptureRequest request = new CaptureRequest();
        request.setSuccess(false);
        request.setError("No input received");

        FormConversationResponse response = controller.capture(SESSION_ID, request);

        assertTrue(response.isSuccess());
        assertFalse(response.isUsable());
        assertEquals("No input received", response.getMessage());
    }

    @Test
    void knownEngineFailureBecomesErrorBody() {
        when(conversationService.get(OTHER_SESSION_ID))
                .thenThrow(new FormEngineException(FormEngineErrorCode.SESSION_NOT_FOUND));

        FormConversationResponse response = controller.state(OTHER_SESSION_ID);

        assertFalse(response.isSuccess());
        assertEquals("SESSION_NOT_FOUND", response.getErrorCode());
        assertFalse(response.isRecoverable());
        verify(audit).audit(eq(FormAuditStage.ENGINE_KNOWN_FAILURE), eq(OTHER_SESSION_ID), anyMap());
    }

    @Test
    void unexpectedFailureIsReportedAsInternalError() {
        when(conversationService.reset(SESSION_ID)).thenThrow(new IllegalStateException(BOOM));

        FormConversationResponse response = controller.reset(SESSION_ID);

        assertFalse(response.isSuccess());
        assertEquals("INTERNAL_ERROR", response.getErrorCode());
        verify(audit).audit(eq(FormAuditStage.ENGINE_UNKNOWN_FAILURE), eq(SESSION_ID), anyMap());
    }

    @Test
    void outputReturnsErrorMapForUnknownSession() {
        when(conversationService.finalOutput(OTHER_SESSION_ID))
                .thenThrow(new FormEngineException(FormEngineErrorCode.SESSION_NOT_FOUND));

        Map<String, Object> output = controller.output(OTHER_SESSION_ID);

        assertEquals("SESSION_NOT_FOUND", output.get("errorCode"));
    }
}

package com.github.salilvnair.formassist.api.controller;

import com.github.salilvnair.formassist.api.dto.CaptureRequest;
import com.github.salilvnair.formassist.api.dto.FormConversationResponse;
import com.github.salilvnair.formassist.api.dto.FormMessageRequest;
import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.Speaker;
import com.github.salilvnair.formassist.engine.model.TurnResult;
import com.github.salilvnair.formassist.service.FormConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/v1/form")
@RequiredArgsConstructor
public class FormConversationController {

    private final FormConversationService conversationService;
    private final AuditService audit;

    @PostMapping("/sessions")
    public FormConversationResponse start() {
        return handle(null, () -> {
            SessionState state = conversationService.start();
            return fromState(state, assistantReplies(state));
        });
    }

    @PostMapping("/sessions/{sessionId}/message")
    public FormConversationResponse message(@PathVariable String sessionId,
                                            @RequestBody FormMessageRequest request) {
        return handle(sessionId, () -> fromTurn(conversationService.processText(sessionId, request.getMessage())));
    }

    @PostMapping("/sessions/{sessionId}/capture")
    public FormConversationResponse capture(@PathVariable String sessionId,
                                            @RequestBody CaptureRequest request) {
        return handle(sessionId, () -> fromTurn(
                conversationService.processCapture(sessionId, request.toTranscriptionResult())));
    }

    @GetMapping("/sessions/{sessionId}")
    public FormConversationResponse state(@PathVariable String sessionId) {
        return handle(sessionId, () -> fromState(conversationService.get(sessionId), List.of()));
    }

    @GetMapping("/sessions/{sessionId}/output")
    public Map<String, Object> output(@PathVariable String sessionId) {
        try {
            return conversationService.finalOutput(sessionId);
        } catch (FormEngineException ex) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put(FormPayloadKey.ERROR_CODE, ex.getErrorCode());
            error.put(FormPayloadKey.MESSAGE, ex.getMessage());
            error.put(FormPayloadKey.RECOVERABLE, ex.isRecoverable());
            return error;
        }
    }

    @PostMapping("/sessions/{sessionId}/reset")
    public FormConversationResponse reset(@PathVariable String sessionId) {
        return handle(sessionId, () -> {
            SessionState state = conversationService.reset(sessionId);
            return fromState(state, assistantReplies(state));
        });
    }

    private FormConversationResponse handle(String sessionId, Supplier<FormConversationResponse> action) {
        try {
            return action.get();
        }
        catch (FormEngineException ex) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(FormPayloadKey.ERROR_CODE, ex.getErrorCode());
            payload.put(FormPayloadKey.MESSAGE, ex.getMessage());
            payload.put(FormPayloadKey.RECOVERABLE, ex.isRecoverable());
            audit.audit(FormAuditStage.ENGINE_KNOWN_FAILURE, sessionId, payload);
            return error(sessionId, ex.getErrorCode(), ex.getMessage(), ex.isRecoverable());
        }
        catch (Exception ex) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(FormPayloadKey.EXCEPTION, String.valueOf(ex));
            payload.put(FormPayloadKey.MESSAGE, ex.getMessage());
            payload.put(FormPayloadKey.RECOVERABLE, false);
            audit.audit(FormAuditStage.ENGINE_UNKNOWN_FAILURE, sessionId, payload);
            return error(sessionId, FormEngineErrorCode.INTERNAL_ERROR.name(),
                    FormEngineErrorCode.INTERNAL_ERROR.defaultMessage(), false);
        }
    }

    private FormConversationResponse fromTurn(TurnResult result) {
        FormConversationResponse res = fromState(result.state(), result.replies());
        res.setUsable(result.usable());
        res.setIntent(result.intent() == null ? null : result.intent().code());
        res.setMessage(result.error());
        return res;
    }

    private FormConversationResponse fromState(SessionState state, List<String> replies) {
        FormConversationResponse res = new FormConversationResponse();
        res.setSuccess(true);
        res.setSessionId(state.getSessionId());
        res.setCurrentField(state.getCurrentField());
        res.setComplete(state.isComplete());
        res.setConfirmationPending(state.isConfirmationPending());
        res.setReplies(replies);
        res.setFieldValues(state.getFieldValues());
        res.setFinalOutput(state.getFinalOutput());
        return res;
    }

    private List<String> assistantReplies(SessionState state) {
        return state.getMessages().stream()
                .filter(m -> m.speaker() == Speaker.ASSISTANT)
                .map(ConversationMessage::text)
                .toList();
    }

    private FormConversationResponse error(String sessionId, String errorCode, String message, boolean recoverable) {
        FormConversationResponse error = new FormConversationResponse();
        error.setSuccess(false);
        error.setSessionId(sessionId);
        error.setErrorCode(errorCode);
        error.setMessage(message);
        error.setRecoverable(recoverable);
        error.setReplies(List.of());
        return error;
    }
}

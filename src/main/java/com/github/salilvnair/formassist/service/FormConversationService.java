package com.github.salilvnair.formassist.service;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.capture.TranscriptionResult;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.core.FormConversationEngine;
import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.TurnResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the session lifecycle. Turns of one session run one at a time; different sessions do not block
 * each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FormConversationService {

    private static final String CAPTURE_FAILED = "Audio capture failed";

    private final FormConversationEngine engine;
    private final FormSessionStore sessionStore;
    private final AuditService audit;

    private final Map<String, SessionLock> locks = new ConcurrentHashMap<>();

    public SessionState start() {
        return start(UUID.randomUUID().toString());
    }

    public SessionState start(String sessionId) {
        return withLock(sessionId, () -> {
            SessionState state = engine.start(sessionId);
            sessionStore.save(state);
            log.info("Started form session {}", sessionId);
            return state;
        });
    }

    public TurnResult processText(String sessionId, String userText) {
        return withLock(sessionId, () -> {
            SessionState current = require(sessionId);
            TurnResult result = engine.advance(current, userText);
            if (result.usable()) {
                sessionStore.save(result.state());
            }
            return result;
        });
    }

    public TurnResult processCapture(String sessionId, TranscriptionResult capture) {
        if (capture == null || !capture.success()) {
            String error = capture == null || capture.error() == null || capture.error().isBlank()
                    ? CAPTURE_FAILED
                    : capture.error();
            return withLock(sessionId, () -> {
                SessionState current = require(sessionId);
                audit.audit(FormAuditStage.INPUT_UNUSABLE, sessionId, Map.of(FormPayloadKey.ERROR, error));
                return TurnResult.unusable(current, error);
            });
        }
        return processText(sessionId, capture.text());
    }

    public SessionState get(String sessionId) {
        return require(sessionId);
    }

    public Map<String, Object> finalOutput(String sessionId) {
        return require(sessionId).getFinalOutput();
    }

    /**
     * Discards the conversation and starts over under the same id.
     */
    public SessionState reset(String sessionId) {
        return withLock(sessionId, () -> {
            require(sessionId);
            sessionStore.delete(sessionId);
            SessionState state = engine.start(sessionId);
            sessionStore.save(state);
            log.info("Reset form session {}", sessionId);
            return state;
        });
    }

    private SessionState require(String sessionId) {
        return sessionStore.find(sessionId)
                .orElseThrow(() -> new FormEngineException(
                        FormEngineErrorCode.SESSION_NOT_FOUND,
                        "No form session exists for id: " + sessionId));
    }

    private <T> T withLock(String sessionId, Supplier<T> action) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new FormEngineException(FormEngineErrorCode.SESSION_NOT_FOUND, "Session id is required");
        }
        SessionLock entry = locks.compute(sessionId, (id, existing) -> {
            SessionLock held = existing == null ? new SessionLock() : existing;
            held.holders++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            // entries live only while a turn is running or waiting
            locks.computeIfPresent(sessionId, (id, held) -> --held.holders == 0 ? null : held);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}

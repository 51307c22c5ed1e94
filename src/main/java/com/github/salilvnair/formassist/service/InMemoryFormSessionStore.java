package com.github.salilvnair.formassist.service;

import com.github.salilvnair.formassist.engine.model.SessionState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryFormSessionStore implements FormSessionStore {

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionState> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void save(SessionState state) {
        sessions.put(state.getSessionId(), state);
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId != null) {
            sessions.remove(sessionId);
        }
    }
}

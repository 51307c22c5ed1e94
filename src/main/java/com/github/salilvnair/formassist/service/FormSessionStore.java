package com.github.salilvnair.formassist.service;

import com.github.salilvnair.formassist.engine.model.SessionState;

import java.util.Optional;

public interface FormSessionStore {
    Optional<SessionState> find(String sessionId);
    void save(SessionState state);
    void delete(String sessionId);
}

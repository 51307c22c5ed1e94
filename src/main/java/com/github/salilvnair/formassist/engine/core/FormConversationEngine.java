package com.github.salilvnair.formassist.engine.core;

import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.TurnResult;

public interface FormConversationEngine {

    /**
     * Fresh conversation positioned on the first field, with the greeting already in the transcript.
     */
    SessionState start(String sessionId);

    /**
     * Runs one user turn against {@code state}. Never throws for user-level problems; the returned
     * result always carries a usable state.
     */
    TurnResult advance(SessionState state, String userText);
}

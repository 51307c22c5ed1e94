package com.github.salilvnair.formassist.engine.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of one form-filling conversation. A turn never mutates a snapshot; it produces the
 * next one.
 */
@Getter
public final class SessionState {

    public static final String TERMINAL_FIELD = "__complete__";

    private final String sessionId;
    private final String currentField;
    private final Set<String> completedFields;
    private final Map<String, Object> fieldValues;
    private final Object pendingValue;
    private final boolean confirmationPending;
    private final int extractionAttempts;
    private final List<ConversationMessage> messages;
    private final boolean complete;
    private final Map<String, Object> finalOutput;

    public SessionState(String sessionId,
                        String currentField,
                        Set<String> completedFields,
                        Map<String, Object> fieldValues,
                        Object pendingValue,
                        boolean confirmationPending,
                        int extractionAttempts,
                        List<ConversationMessage> messages,
                        boolean complete,
                        Map<String, Object> finalOutput) {
        this.sessionId = sessionId;
        this.currentField = currentField;
        this.completedFields = Collections.unmodifiableSet(new LinkedHashSet<>(
                completedFields == null ? Set.of() : completedFields));
        this.fieldValues = Collections.unmodifiableMap(new LinkedHashMap<>(
                fieldValues == null ? Map.of() : fieldValues));
        this.pendingValue = confirmationPending ? pendingValue : null;
        this.confirmationPending = confirmationPending;
        this.extractionAttempts = extractionAttempts;
        this.messages = Collections.unmodifiableList(new ArrayList<>(
                messages == null ? List.of() : messages));
        this.complete = complete;
        this.finalOutput = complete
                ? Collections.unmodifiableMap(new LinkedHashMap<>(finalOutput == null ? Map.of() : finalOutput))
                : Map.of();
    }

    public static SessionState initial(String sessionId, String firstField, String greeting) {
        return new SessionState(sessionId, firstField, Set.of(), Map.of(), null, false, 0,
                List.of(ConversationMessage.assistant(greeting)), false, Map.of());
    }

    public boolean isAtTerminalField() {
        return TERMINAL_FIELD.equals(currentField);
    }

    /**
     * Copy with one more transcript entry; every other field is carried over.
     */
    public SessionState withMessages(List<ConversationMessage> extra) {
        List<ConversationMessage> merged = new ArrayList<>(messages);
        merged.addAll(extra);
        return new SessionState(sessionId, currentField, completedFields, fieldValues, pendingValue,
                confirmationPending, extractionAttempts, merged, complete, finalOutput);
    }
}

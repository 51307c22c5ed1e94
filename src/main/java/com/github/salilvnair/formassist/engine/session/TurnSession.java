package com.github.salilvnair.formassist.engine.session;

import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.StepTiming;
import com.github.salilvnair.formassist.engine.model.TurnResult;
import com.github.salilvnair.formassist.extraction.ExtractedIntent;
import com.github.salilvnair.formassist.extraction.IntentType;
import com.github.salilvnair.formassist.validation.ValidationOutcome;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable working copy of a {@link SessionState} for the duration of one turn. Steps change this copy
 * only; the next immutable state is taken from it once the whole pipeline has run.
 */
@Getter
@Setter
public class TurnSession {

    private final SessionState priorState;
    private final String sessionId;
    private final String userText;

    private String currentField;
    private final Set<String> completedFields;
    private final Map<String, Object> fieldValues;
    private Object pendingValue;
    private boolean confirmationPending;
    private int extractionAttempts;
    private final List<ConversationMessage> messages;
    private boolean complete;
    private Map<String, Object> finalOutput;

    // per-turn
    private ExtractedIntent extractedIntent;
    private ValidationOutcome validationOutcome;
    private IntentType handledIntent;
    private boolean handled;
    private boolean committed;
    private final List<String> replies = new ArrayList<>();
    private final List<StepTiming> stepTimings = new ArrayList<>();

    public TurnSession(SessionState state, String userText) {
        this.priorState = state;
        this.sessionId = state.getSessionId();
        this.userText = userText;
        this.currentField = state.getCurrentField();
        this.completedFields = new LinkedHashSet<>(state.getCompletedFields());
        this.fieldValues = new LinkedHashMap<>(state.getFieldValues());
        this.pendingValue = state.getPendingValue();
        this.confirmationPending = state.isConfirmationPending();
        this.extractionAttempts = state.getExtractionAttempts();
        this.messages = new ArrayList<>(state.getMessages());
        this.complete = state.isComplete();
        this.finalOutput = new LinkedHashMap<>(state.getFinalOutput());
    }

    public void reply(String text) {
        messages.add(ConversationMessage.assistant(text));
        replies.add(text);
    }

    public void recordUserInput() {
        messages.add(ConversationMessage.user(userText));
    }

    /**
     * Marks the turn as answered by the given intent so later branch steps stand aside.
     */
    public void markHandled(IntentType intent) {
        this.handled = true;
        this.handledIntent = intent;
    }

    public void commitValue(String field, Object value) {
        fieldValues.put(field, value);
        completedFields.add(field);
        clearPending();
        extractionAttempts = 0;
        committed = true;
    }

    public void clearPending() {
        pendingValue = null;
        confirmationPending = false;
    }

    public void holdForConfirmation(Object value) {
        pendingValue = value;
        confirmationPending = true;
    }

    public void incrementAttempts() {
        extractionAttempts++;
    }

    public boolean isAtTerminalField() {
        return SessionState.TERMINAL_FIELD.equals(currentField);
    }

    public List<ConversationMessage> lastMessages(int count) {
        if (count <= 0 || messages.isEmpty()) {
            return List.of();
        }
        return List.copyOf(messages.subList(Math.max(0, messages.size() - count), messages.size()));
    }

    public SessionState toState() {
        return new SessionState(sessionId, currentField, completedFields, fieldValues, pendingValue,
                confirmationPending, extractionAttempts, messages, complete, finalOutput);
    }

    public TurnResult toTurnResult() {
        return new TurnResult(toState(), true, List.copyOf(replies), handledIntent, null);
    }
}

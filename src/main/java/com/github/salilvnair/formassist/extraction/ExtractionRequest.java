package com.github.salilvnair.formassist.extraction;

import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.schema.FormFieldSpec;

import java.util.List;

public record ExtractionRequest(
        String userText,
        FormFieldSpec field,
        List<ConversationMessage> history,
        Object pendingValue,
        boolean confirmationPending
) {

    public ExtractionRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }
}

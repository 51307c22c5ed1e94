package com.github.salilvnair.formassist.engine.helper;

import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.guidance.GuidanceComposer;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.schema.FormSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class FieldProgressionHelper {

    private final FormSchema formSchema;
    private final GuidanceComposer guidanceComposer;

    public FormFieldSpec currentField(TurnSession session) {
        return formSchema.field(session.getCurrentField())
                .orElseThrow(() -> new FormEngineException(
                        FormEngineErrorCode.INTERNAL_ERROR,
                        "Session is not positioned on a form field: " + session.getCurrentField())
                        .withMetaData(Map.of("sessionId", String.valueOf(session.getSessionId()))));
    }

    /**
     * Moves the pointer to the next schema field and asks for it. The pointer is parked on
     * {@link SessionState#TERMINAL_FIELD} instead once the last field is done or no required field is
     * left, since the form completes at that point.
     */
    public void advance(TurnSession session) {
        Optional<String> next = formSchema.nextField(session.getCurrentField());
        session.setExtractionAttempts(0);
        if (next.isEmpty() || firstMissingRequired(session).isEmpty()) {
            session.setCurrentField(SessionState.TERMINAL_FIELD);
            return;
        }
        session.setCurrentField(next.get());
        formSchema.field(next.get())
                .ifPresent(field -> session.reply(guidanceComposer.composePrompt(field)));
    }

    /**
     * First required field, in schema order, without an accepted value.
     */
    public Optional<FormFieldSpec> firstMissingRequired(TurnSession session) {
        return formSchema.fields().stream()
                .filter(FormFieldSpec::required)
                .filter(f -> !session.getCompletedFields().contains(f.name()))
                .findFirst();
    }

    public void moveTo(TurnSession session, FormFieldSpec field) {
        session.setCurrentField(field.name());
        session.setExtractionAttempts(0);
        session.reply(guidanceComposer.composePrompt(field));
    }
}

package com.github.salilvnair.formassist.guidance;

import com.github.salilvnair.formassist.config.FormAssistFlowConfig;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.validation.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds every field-specific sentence the assistant says: prompts, help, validation guidance, the
 * greeting and the closing summary.
 */
@Component
@RequiredArgsConstructor
public class GuidanceComposer {

    private final FormAssistFlowConfig flowConfig;

    public String compose(FormFieldSpec field, ValidationOutcome outcome, int attemptCount) {
        FieldGuidance guidance = guidanceFor(field);
        StringBuilder message = new StringBuilder("I'm having trouble understanding your ")
                .append(field.label()).append(". ")
                .append(guidance.explanation());
        if (outcome != null) {
            if (outcome.constraintHint() != null) {
                message.append(" Expected: ").append(outcome.constraintHint()).append('.');
            }
            if (outcome.validOptions() != null && !outcome.validOptions().isEmpty()) {
                message.append(" Valid options are: ").append(String.join(", ", outcome.validOptions())).append('.');
            }
            if (outcome.suggestedCorrection() != null) {
                message.append(" Did you mean '").append(renderValue(outcome.suggestedCorrection())).append("'?");
            }
        }
        message.append(" Could you please try again?");
        if (attemptCount >= flowConfig.getEscalationThreshold() && !guidance.examples().isEmpty()) {
            message.append(" Here are some examples: ")
                    .append(guidance.examples().stream()
                            .map(e -> "'" + e + "'")
                            .collect(Collectors.joining(", ")))
                    .append('.');
        }
        return message.toString();
    }

    public String composeHelp(FormFieldSpec field) {
        return FieldGuidanceCatalog.forField(field.name())
                .map(FieldGuidance::help)
                .orElse("I need information about " + describe(field) + ". Could you please provide that?");
    }

    public String composePrompt(FormFieldSpec field) {
        return FieldGuidanceCatalog.forField(field.name())
                .map(FieldGuidance::prompt)
                .orElse("Now, please tell me " + describe(field) + ".");
    }

    public String composeGreeting(FormFieldSpec firstField) {
        return "Hello! I'm your voice assistant, here to help you complete this form. Let's start with your "
                + firstField.label() + ". " + composePrompt(firstField);
    }

    public String composeSummary(Map<String, Object> finalOutput) {
        String summary = finalOutput.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> "- " + e.getKey() + ": " + renderValue(e.getValue()))
                .collect(Collectors.joining("\n"));
        return "Excellent! We've completed all the required information. "
                + "Here's a summary of what you've provided:\n\n"
                + summary
                + "\n\nThank you for providing all this information. The form has been submitted successfully.";
    }

    /**
     * Lists read as comma separated text in replies; everything else uses its string form.
     */
    public String renderValue(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }

    private FieldGuidance guidanceFor(FormFieldSpec field) {
        return FieldGuidanceCatalog.forField(field.name())
                .orElseGet(() -> new FieldGuidance(
                        "The provided value for " + field.label() + " is invalid.",
                        List.of(),
                        null,
                        null));
    }

    private String describe(FormFieldSpec field) {
        String description = field.description();
        return description == null || description.isBlank() ? "your " + field.label() : description;
    }
}

package com.github.salilvnair.formassist.guidance;

import com.github.salilvnair.formassist.config.FormAssistFlowConfig;
import com.github.salilvnair.formassist.schema.FieldConstraints;
import com.github.salilvnair.formassist.schema.FieldType;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.schema.FormSchema;
import com.github.salilvnair.formassist.schema.FormSchemaDefinition;
import com.github.salilvnair.formassist.validation.ConstraintViolation;
import com.github.salilvnair.formassist.validation.FieldValidator;
import com.github.salilvnair.formassist.validation.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.formassist.support.TestConstants.UNKNOWN_FIELD;
import static org.junit.jupiter.api.Assertions.*;

class GuidanceComposerTest {

    private final GuidanceComposer composer = new GuidanceComposer(new FormAssistFlowConfig());
    private final FormSchema schema = FormSchemaDefinition.registrationForm();

    @Test
    void composeExplainsTheFieldWithoutExamplesBelowThreshold() {
        FormFieldSpec age = field(FormSchemaDefinition.AGE);
        ValidationOutcome outcome = ValidationOutcome.invalid(15, ConstraintViolation.MIN_VALUE, "Value must be between 18 and 120");

        String message = composer.compose(age, outcome, 1);

        assertEquals("I'm having trouble understanding your age. Your age should be a number between 18 and 120."
                + " Could you please try again?", message);
    }

    @Test
    void composeAddsExamplesOnceAttemptsReachThreshold() {
        FormFieldSpec age = field(FormSchemaDefinition.AGE);

        String message = composer.compose(age, null, 3);

        assertTrue(message.endsWith("Here are some examples: '30', '45', '62'."));
    }

    @Test
    void composeIncludesHintAndSuggestion() {
        FormFieldSpec level = field(FormSchemaDefinition.EXPERIENCE_LEVEL);
        ValidationOutcome outcome = ValidationOutcome.invalid("inter", ConstraintViolation.NOT_IN_OPTIONS, "bad")
                .withConstraintHint("one of Beginner, Intermediate")
                .withSuggestedCorrection("Intermediate");

        String message = composer.compose(level, outcome, 1);

        assertTrue(message.contains("Expected: one of Beginner, Intermediate."));
        assertTrue(message.contains("Did you mean 'Intermediate'?"));
        assertTrue(message.endsWith("Could you please try again?"));
    }

    @Test
    void invalidEnumValueListsTheOptionsOnFirstAttempt() {
        FormFieldSpec level = field(FormSchemaDefinition.EXPERIENCE_LEVEL);
        ValidationOutcome outcome = new FieldValidator().validate(level, "guru", Map.of());

        String message = composer.compose(level, outcome, 1);

        assertTrue(message.contains("Valid options are: Beginner, Intermediate, Advanced, Expert."));
        assertFalse(message.contains("Here are some examples"));
    }

    @Test
    void promptAndHelpFallBackToTheDescriptionForUncataloguedFields() {
        FormFieldSpec custom = new FormFieldSpec(UNKNOWN_FIELD, FieldType.STRING, "Your favourite colour", 0, false,
                FieldConstraints.none());

        assertEquals("Now, please tell me Your favourite colour.", composer.composePrompt(custom));
        assertTrue(composer.composeHelp(custom).startsWith("I need information about Your favourite colour."));
        assertTrue(composer.compose(custom, null, 5)
                .contains("The provided value for favourite colour is invalid."));
    }

    @Test
    void greetingNamesTheFirstField() {
        String greeting = composer.composeGreeting(schema.firstField());

        assertTrue(greeting.startsWith("Hello!"));
        assertTrue(greeting.endsWith("Let's start with your full name. What is your full name?"));
    }

    @Test
    void summaryListsNonNullValuesInOrder() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put(FormSchemaDefinition.FULL_NAME, "John Smith");
        output.put(FormSchemaDefinition.PROJECT_INTERESTS, Arrays.asList("Web Development", "AI"));
        output.put(FormSchemaDefinition.ADDITIONAL_NOTES, null);

        String summary = composer.composeSummary(output);

        assertTrue(summary.contains("- full_name: John Smith\n- project_interests: Web Development, AI"));
        assertFalse(summary.contains("additional_notes"));
        assertTrue(summary.endsWith("The form has been submitted successfully."));
    }

    @Test
    void renderValueJoinsLists() {
        assertEquals("a, b", composer.renderValue(List.of("a", "b")));
        assertEquals("42", composer.renderValue(42));
    }

    private FormFieldSpec field(String name) {
        return schema.field(name).orElseThrow();
    }
}

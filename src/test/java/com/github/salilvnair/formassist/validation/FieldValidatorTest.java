package com.github.salilvnair.formassist.validation;

import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.schema.FormSchema;
import com.github.salilvnair.formassist.schema.FormSchemaDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldValidatorTest {

    private final FormSchema schema = FormSchemaDefinition.registrationForm();
    private final FieldValidator validator = new FieldValidator();

    @Test
    void acceptsTrimmedName() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.FULL_NAME, "  John Smith ");

        assertTrue(outcome.valid());
        assertEquals("John Smith", outcome.value());
    }

    @Test
    void rejectsOneLetterName() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.FULL_NAME, "J");

        assertFalse(outcome.valid());
        assertEquals(ConstraintViolation.MIN_LENGTH, outcome.error().violation());
    }

    @Test
    void coercesNumericStringsForIntegers() {
        assertEquals(30, validate(FormSchemaDefinition.AGE, "30").value());
        assertEquals(30, validate(FormSchemaDefinition.AGE, "30.0").value());
        assertEquals(30, validate(FormSchemaDefinition.AGE, 30.0d).value());
    }

    @Test
    void ageOutsideRangeNamesTheRange() {
        ValidationOutcome low = validate(FormSchemaDefinition.AGE, 15);
        ValidationOutcome high = validate(FormSchemaDefinition.AGE, 121);

        assertEquals(ConstraintViolation.MIN_VALUE, low.error().violation());
        assertEquals("Value must be between 18 and 120", low.errorMessage());
        assertEquals(ConstraintViolation.MAX_VALUE, high.error().violation());
    }

    @Test
    void nonNumericAgeIsATypeMismatch() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.AGE, "fifteen");

        assertFalse(outcome.valid());
        assertEquals(ConstraintViolation.TYPE_MISMATCH, outcome.error().violation());
    }

    @Test
    void nonFiniteNumbersFailAsTypeMismatch() {
        ValidationOutcome infinite = validate(FormSchemaDefinition.AGE, Double.POSITIVE_INFINITY);
        ValidationOutcome notANumber = validate(FormSchemaDefinition.AVAILABILITY_PER_WEEK, Float.NaN);

        assertFalse(infinite.valid());
        assertEquals(ConstraintViolation.TYPE_MISMATCH, infinite.error().violation());
        assertEquals(ConstraintViolation.TYPE_MISMATCH, notANumber.error().violation());
    }

    @Test
    void enumMatchesCaseInsensitivelyToCanonicalOption() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.EXPERIENCE_LEVEL, "advanced");

        assertTrue(outcome.valid());
        assertEquals("Advanced", outcome.value());
    }

    @Test
    void unknownEnumValueListsOptionsAndSuggests() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.EXPERIENCE_LEVEL, "inter");

        assertFalse(outcome.valid());
        assertEquals(ConstraintViolation.NOT_IN_OPTIONS, outcome.error().violation());
        assertEquals(List.of("Beginner", "Intermediate", "Advanced", "Expert"), outcome.validOptions());
        assertEquals("Intermediate", outcome.suggestedCorrection());
    }

    @Test
    void languageOptionsIncludeCPlusPlus() {
        assertTrue(validate(FormSchemaDefinition.PREFERRED_LANGUAGE, "c++").valid());
        assertFalse(validate(FormSchemaDefinition.PREFERRED_LANGUAGE, "Cobol").valid());
    }

    @Test
    void spokenEmailGetsASuggestion() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.EMAIL, "john at example dot com");

        assertFalse(outcome.valid());
        assertEquals(ConstraintViolation.PATTERN_MISMATCH, outcome.error().violation());
        assertEquals("john@example.com", outcome.suggestedCorrection());
    }

    @Test
    void commaSeparatedInterestsBecomeAList() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.PROJECT_INTERESTS, "Web Development, , Machine Learning");

        assertTrue(outcome.valid());
        assertEquals(List.of("Web Development", "Machine Learning"), outcome.value());
    }

    @Test
    void tooManyInterestsCarryTheListHint() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.PROJECT_INTERESTS,
                List.of("aa", "bb", "cc", "dd", "ee", "ff"));

        assertEquals(ConstraintViolation.MAX_ITEMS, outcome.error().violation());
        assertEquals("A list of 1-5 project interests, each between 2-100 characters", outcome.constraintHint());
    }

    @Test
    void shortInterestItemIsRejected() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.PROJECT_INTERESTS, List.of("AI", "x"));

        assertEquals(ConstraintViolation.ITEM_LENGTH, outcome.error().violation());
    }

    @Test
    void emptyInterestListIsRejected() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.PROJECT_INTERESTS, List.of());

        assertEquals(ConstraintViolation.MIN_ITEMS, outcome.error().violation());
    }

    @Test
    void datesMustBeIsoAndReal() {
        assertTrue(validate(FormSchemaDefinition.START_DATE, "2025-06-01").valid());
        assertEquals(ConstraintViolation.INVALID_DATE,
                validate(FormSchemaDefinition.START_DATE, "June 1st").error().violation());
        assertEquals(ConstraintViolation.INVALID_DATE,
                validate(FormSchemaDefinition.START_DATE, "2025-02-30").error().violation());
    }

    @Test
    void availabilityBounds() {
        assertTrue(validate(FormSchemaDefinition.AVAILABILITY_PER_WEEK, 1).valid());
        assertTrue(validate(FormSchemaDefinition.AVAILABILITY_PER_WEEK, 168).valid());
        assertFalse(validate(FormSchemaDefinition.AVAILABILITY_PER_WEEK, 0).valid());
        assertFalse(validate(FormSchemaDefinition.AVAILABILITY_PER_WEEK, 169).valid());
    }

    @Test
    void notesLongerThanFiveHundredCharactersFail() {
        assertTrue(validate(FormSchemaDefinition.ADDITIONAL_NOTES, "a".repeat(500)).valid());
        assertEquals(ConstraintViolation.MAX_LENGTH,
                validate(FormSchemaDefinition.ADDITIONAL_NOTES, "a".repeat(501)).error().violation());
    }

    @Test
    void nullCandidateIsMissing() {
        ValidationOutcome outcome = validate(FormSchemaDefinition.OCCUPATION, null);

        assertEquals(ConstraintViolation.MISSING_VALUE, outcome.error().violation());
    }

    private ValidationOutcome validate(String fieldName, Object candidate) {
        FormFieldSpec field = schema.field(fieldName).orElseThrow();
        return validator.validate(field, candidate, Map.of());
    }
}

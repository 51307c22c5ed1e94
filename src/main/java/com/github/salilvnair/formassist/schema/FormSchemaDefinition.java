package com.github.salilvnair.formassist.schema;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The registration form collected by the assistant.
 */
public final class FormSchemaDefinition {

    public static final String FULL_NAME = "full_name";
    public static final String EMAIL = "email";
    public static final String AGE = "age";
    public static final String OCCUPATION = "occupation";
    public static final String EXPERIENCE_LEVEL = "experience_level";
    public static final String PREFERRED_LANGUAGE = "preferred_language";
    public static final String PROJECT_INTERESTS = "project_interests";
    public static final String AVAILABILITY_PER_WEEK = "availability_per_week";
    public static final String START_DATE = "start_date";
    public static final String ADDITIONAL_NOTES = "additional_notes";

    public static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+$");

    private FormSchemaDefinition() {
    }

    public static FormSchema registrationForm() {
        return new FormSchema(List.of(
                new FormFieldSpec(FULL_NAME, FieldType.STRING, "User's full name", 0, true,
                        FieldConstraints.builder().minLength(2).maxLength(100).build()),
                new FormFieldSpec(EMAIL, FieldType.STRING, "User's email address", 1, true,
                        FieldConstraints.builder().pattern(EMAIL_PATTERN).build()),
                new FormFieldSpec(AGE, FieldType.INTEGER, "User's age in years", 2, true,
                        FieldConstraints.builder().minValue(18).maxValue(120).build()),
                new FormFieldSpec(OCCUPATION, FieldType.STRING, "User's current job or profession", 3, true,
                        FieldConstraints.builder().minLength(2).maxLength(100).build()),
                new FormFieldSpec(EXPERIENCE_LEVEL, FieldType.ENUM, "User's experience level in their field", 4, true,
                        FieldConstraints.builder()
                                .options(List.of("Beginner", "Intermediate", "Advanced", "Expert"))
                                .build()),
                new FormFieldSpec(PREFERRED_LANGUAGE, FieldType.ENUM, "User's preferred programming language", 5, true,
                        FieldConstraints.builder()
                                .options(List.of("Python", "JavaScript", "Java", "C++", "Go", "Rust", "Other"))
                                .build()),
                new FormFieldSpec(PROJECT_INTERESTS, FieldType.STRING_LIST, "List of project interests or goals", 6, true,
                        FieldConstraints.builder()
                                .minItems(1).maxItems(5)
                                .itemMinLength(2).itemMaxLength(100)
                                .build()),
                new FormFieldSpec(AVAILABILITY_PER_WEEK, FieldType.INTEGER, "Hours available per week for the project", 7, true,
                        FieldConstraints.builder().minValue(1).maxValue(168).build()),
                new FormFieldSpec(START_DATE, FieldType.DATE, "Preferred project start date", 8, true,
                        FieldConstraints.none()),
                new FormFieldSpec(ADDITIONAL_NOTES, FieldType.STRING, "Any additional information or special requirements", 9, false,
                        FieldConstraints.builder().maxLength(500).build())
        ));
    }
}

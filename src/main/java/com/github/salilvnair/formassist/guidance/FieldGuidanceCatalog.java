package com.github.salilvnair.formassist.guidance;

import com.github.salilvnair.formassist.schema.FormSchemaDefinition;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@UtilityClass
public class FieldGuidanceCatalog {

    private static final Map<String, FieldGuidance> GUIDANCE = Map.of(
            FormSchemaDefinition.FULL_NAME, new FieldGuidance(
                    "Your name should be between 2 and 100 characters.",
                    List.of("John Smith", "Maria Rodriguez", "Ahmed Khan"),
                    "I need your full name. For example, 'John Smith' or 'Maria Rodriguez'.",
                    "What is your full name?"),
            FormSchemaDefinition.EMAIL, new FieldGuidance(
                    "Please provide a valid email address.",
                    List.of("user@example.com", "name.surname@company.co.uk"),
                    "I need a valid email address where you can be contacted. For example, 'user@example.com'.",
                    "What is your email address?"),
            FormSchemaDefinition.AGE, new FieldGuidance(
                    "Your age should be a number between 18 and 120.",
                    List.of("30", "45", "62"),
                    "Please provide your age as a number between 18 and 120.",
                    "How old are you?"),
            FormSchemaDefinition.OCCUPATION, new FieldGuidance(
                    "Your occupation should be between 2 and 100 characters.",
                    List.of("Software Engineer", "Teacher", "Data Analyst"),
                    "I need your current job or profession. For example, 'Software Engineer' or 'Teacher'.",
                    "What is your current job or profession?"),
            FormSchemaDefinition.EXPERIENCE_LEVEL, new FieldGuidance(
                    "Please select one of the valid experience levels.",
                    List.of("Beginner", "Intermediate", "Advanced", "Expert"),
                    "Please select your experience level from: Beginner, Intermediate, Advanced, or Expert.",
                    "Now, please tell me your experience level. Choose from: Beginner, Intermediate, Advanced, or Expert."),
            FormSchemaDefinition.PREFERRED_LANGUAGE, new FieldGuidance(
                    "Please select one of the valid programming languages.",
                    List.of("Python", "JavaScript", "Java", "C++", "Go", "Rust", "Other"),
                    "Please select your preferred programming language from: Python, JavaScript, Java, C++, Go, Rust, or Other.",
                    "What's your preferred programming language? Options are: Python, JavaScript, Java, C++, Go, Rust, or Other."),
            FormSchemaDefinition.PROJECT_INTERESTS, new FieldGuidance(
                    "Please provide 1 to 5 project interests.",
                    List.of("Web Development", "Machine Learning, Data Analysis", "Game Development, Mobile Apps, Cloud Computing"),
                    "Please list between 1 and 5 project areas you're interested in. For example, 'Web Development, Machine Learning'.",
                    "What projects are you interested in? You can list between 1 and 5 interests."),
            FormSchemaDefinition.AVAILABILITY_PER_WEEK, new FieldGuidance(
                    "Please provide a number between 1 and 168 for weekly availability hours.",
                    List.of("10", "20", "40"),
                    "How many hours per week can you dedicate to the project? Please provide a number between 1 and 168.",
                    "How many hours per week are you available for the project?"),
            FormSchemaDefinition.START_DATE, new FieldGuidance(
                    "Please provide a valid date in YYYY-MM-DD format.",
                    List.of("2025-06-01", "2025-07-15", "2025-08-30"),
                    "When would you like to start? Please provide a date in YYYY-MM-DD format, for example, '2025-06-01'.",
                    "When would you like to start? Please provide a date in YYYY-MM-DD format."),
            FormSchemaDefinition.ADDITIONAL_NOTES, new FieldGuidance(
                    "Additional notes can be at most 500 characters.",
                    List.of("I prefer remote work", "Available only on weekends"),
                    "You can add any special requirements or other information, up to 500 characters. This field is optional, so you can also skip it.",
                    "Is there anything else you'd like to add, such as special requirements? This is optional, so you can also say skip.")
    );

    public static Optional<FieldGuidance> forField(String fieldName) {
        return Optional.ofNullable(fieldName == null ? null : GUIDANCE.get(fieldName));
    }
}

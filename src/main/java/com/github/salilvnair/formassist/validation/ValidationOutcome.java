package com.github.salilvnair.formassist.validation;

import java.util.List;

/**
 * Result of validating one candidate value. {@code value} holds the coerced candidate, whether or not it
 * passed.
 */
public record ValidationOutcome(
        boolean valid,
        Object value,
        ValidationError error,
        Object suggestedCorrection,
        List<String> validOptions,
        String constraintHint
) {

    public static ValidationOutcome valid(Object value) {
        return new ValidationOutcome(true, value, null, null, null, null);
    }

    public static ValidationOutcome invalid(Object value, ConstraintViolation violation, String message) {
        return new ValidationOutcome(false, value, new ValidationError(violation, message), null, null, null);
    }

    public ValidationOutcome withSuggestedCorrection(Object suggestion) {
        return new ValidationOutcome(valid, value, error, suggestion, validOptions, constraintHint);
    }

    public ValidationOutcome withValidOptions(List<String> options) {
        return new ValidationOutcome(valid, value, error, suggestedCorrection,
                options == null ? null : List.copyOf(options), constraintHint);
    }

    public ValidationOutcome withConstraintHint(String hint) {
        return new ValidationOutcome(valid, value, error, suggestedCorrection, validOptions, hint);
    }

    public String errorMessage() {
        return error == null ? null : error.message();
    }
}

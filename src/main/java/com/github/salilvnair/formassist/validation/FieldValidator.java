package com.github.salilvnair.formassist.validation;

import com.github.salilvnair.formassist.schema.FieldConstraints;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces and checks a candidate value against the constraints of a single field.
 * Stateless; never throws for bad input.
 */
@Component
public class FieldValidator {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern INTEGRAL_NUMBER = Pattern.compile("^[+-]?\\d+(\\.0+)?$");
    private static final Pattern SPOKEN_AT = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPOKEN_DOT = Pattern.compile("\\s+dot\\s+", Pattern.CASE_INSENSITIVE);

    public ValidationOutcome validate(FormFieldSpec field, Object candidateValue, Map<String, Object> existingValues) {
        Object value = coerce(field, candidateValue);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return ValidationOutcome.invalid(null, ConstraintViolation.MISSING_VALUE, "No value was extracted");
        }
        return switch (field.type()) {
            case STRING -> validateString(field, value);
            case INTEGER -> validateInteger(field, value);
            case ENUM -> validateEnum(field, value);
            case DATE -> validateDate(value);
            case STRING_LIST -> validateList(field, value);
        };
    }

    /**
     * Best-effort typed coercion. Values that cannot be coerced come back unchanged.
     */
    public Object coerce(FormFieldSpec field, Object value) {
        if (value == null) {
            return null;
        }
        return switch (field.type()) {
            case STRING -> coerceString(value);
            case INTEGER -> coerceInteger(value);
            case ENUM -> coerceEnum(field.constraints(), value);
            case DATE -> coerceDate(value);
            case STRING_LIST -> coerceList(value);
        };
    }

    private Object coerceString(Object value) {
        if (value instanceof String s) {
            return s.trim();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return value;
    }

    private Object coerceInteger(Object value) {
        if (value instanceof Integer) {
            return value;
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return value;
        }
        if (value instanceof Float f && !Float.isFinite(f)) {
            return value;
        }
        if (value instanceof Number number) {
            try {
                return toIntExact(new BigDecimal(number.toString()), value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (INTEGRAL_NUMBER.matcher(trimmed).matches()) {
                return toIntExact(new BigDecimal(trimmed), value);
            }
        }
        return value;
    }

    private Object toIntExact(BigDecimal decimal, Object fallback) {
        try {
            return decimal.stripTrailingZeros().intValueExact();
        }
        catch (ArithmeticException e) {
            return fallback;
        }
    }

    private Object coerceEnum(FieldConstraints constraints, Object value) {
        if (!(value instanceof String s)) {
            return value;
        }
        String trimmed = s.trim();
        for (String option : constraints.optionsOrEmpty()) {
            if (option.equalsIgnoreCase(trimmed)) {
                return option;
            }
        }
        return trimmed;
    }

    private Object coerceDate(Object value) {
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof String s) {
            return s.trim();
        }
        return value;
    }

    private Object coerceList(Object value) {
        if (value instanceof String s) {
            List<String> items = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
            return items;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : collection) {
                if (item == null) {
                    continue;
                }
                if (item instanceof String s) {
                    if (!s.isBlank()) {
                        items.add(s.trim());
                    }
                }
                else {
                    items.add(item);
                }
            }
            return items;
        }
        return value;
    }

    private ValidationOutcome validateString(FormFieldSpec field, Object value) {
        if (!(value instanceof String s)) {
            return ValidationOutcome.invalid(value, ConstraintViolation.TYPE_MISMATCH,
                    "Expected text for " + field.label());
        }
        FieldConstraints c = field.constraints();
        if (c.getMinLength() != null && s.length() < c.getMinLength()) {
            return ValidationOutcome.invalid(s, ConstraintViolation.MIN_LENGTH,
                    "Value must be at least " + c.getMinLength() + " characters long");
        }
        if (c.getMaxLength() != null && s.length() > c.getMaxLength()) {
            return ValidationOutcome.invalid(s, ConstraintViolation.MAX_LENGTH,
                    "Value must be at most " + c.getMaxLength() + " characters long");
        }
        if (c.getPattern() != null && !c.getPattern().matcher(s).matches()) {
            ValidationOutcome outcome = ValidationOutcome.invalid(s, ConstraintViolation.PATTERN_MISMATCH,
                    "Value does not look like a valid " + field.label());
            String spoken = normalizeSpoken(s);
            if (!spoken.equals(s) && c.getPattern().matcher(spoken).matches()) {
                outcome = outcome.withSuggestedCorrection(spoken);
            }
            return outcome;
        }
        return ValidationOutcome.valid(s);
    }

    private ValidationOutcome validateInteger(FormFieldSpec field, Object value) {
        if (!(value instanceof Integer number)) {
            return ValidationOutcome.invalid(value, ConstraintViolation.TYPE_MISMATCH,
                    "Expected a whole number for " + field.label());
        }
        FieldConstraints c = field.constraints();
        if (c.getMinValue() != null && number < c.getMinValue()) {
            return ValidationOutcome.invalid(number, ConstraintViolation.MIN_VALUE,
                    rangeMessage(c, "at least " + c.getMinValue()));
        }
        if (c.getMaxValue() != null && number > c.getMaxValue()) {
            return ValidationOutcome.invalid(number, ConstraintViolation.MAX_VALUE,
                    rangeMessage(c, "at most " + c.getMaxValue()));
        }
        return ValidationOutcome.valid(number);
    }

    private String rangeMessage(FieldConstraints c, String fallback) {
        if (c.getMinValue() != null && c.getMaxValue() != null) {
            return "Value must be between " + c.getMinValue() + " and " + c.getMaxValue();
        }
        return "Value must be " + fallback;
    }

    private ValidationOutcome validateEnum(FormFieldSpec field, Object value) {
        List<String> options = field.constraints().optionsOrEmpty();
        if (value instanceof String s && options.contains(s)) {
            return ValidationOutcome.valid(s);
        }
        ValidationOutcome outcome = ValidationOutcome.invalid(value, ConstraintViolation.NOT_IN_OPTIONS,
                        "Value must be one of: " + String.join(", ", options))
                .withValidOptions(options);
        if (value instanceof String s) {
            String suggestion = closestOption(options, s);
            if (suggestion != null) {
                outcome = outcome.withSuggestedCorrection(suggestion);
            }
        }
        return outcome;
    }

    private String closestOption(List<String> options, String input) {
        String needle = input.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return null;
        }
        for (String option : options) {
            if (option.toLowerCase(Locale.ROOT).startsWith(needle)) {
                return option;
            }
        }
        for (String option : options) {
            if (Pattern.compile("\\b" + Pattern.quote(option.toLowerCase(Locale.ROOT)) + "\\b")
                    .matcher(needle).find()) {
                return option;
            }
        }
        return null;
    }

    private ValidationOutcome validateDate(Object value) {
        if (!(value instanceof String s) || !ISO_DATE.matcher(s).matches()) {
            return ValidationOutcome.invalid(value, ConstraintViolation.INVALID_DATE,
                    "Date must use the YYYY-MM-DD format");
        }
        try {
            LocalDate.parse(s);
            return ValidationOutcome.valid(s);
        }
        catch (DateTimeParseException e) {
            return ValidationOutcome.invalid(s, ConstraintViolation.INVALID_DATE,
                    "'" + s + "' is not a valid calendar date");
        }
    }

    private ValidationOutcome validateList(FormFieldSpec field, Object value) {
        String hint = listHint(field);
        if (!(value instanceof List<?> list)) {
            return ValidationOutcome.invalid(value, ConstraintViolation.TYPE_MISMATCH,
                    "Expected a list for " + field.label()).withConstraintHint(hint);
        }
        FieldConstraints c = field.constraints();
        if (c.getMinItems() != null && list.size() < c.getMinItems()) {
            return ValidationOutcome.invalid(list, ConstraintViolation.MIN_ITEMS,
                    "Provide at least " + c.getMinItems() + " item(s)").withConstraintHint(hint);
        }
        if (c.getMaxItems() != null && list.size() > c.getMaxItems()) {
            return ValidationOutcome.invalid(list, ConstraintViolation.MAX_ITEMS,
                    "Provide at most " + c.getMaxItems() + " items").withConstraintHint(hint);
        }
        for (Object item : list) {
            if (!(item instanceof String s)) {
                return ValidationOutcome.invalid(list, ConstraintViolation.TYPE_MISMATCH,
                        "Every item must be text").withConstraintHint(hint);
            }
            boolean tooShort = c.getItemMinLength() != null && s.length() < c.getItemMinLength();
            boolean tooLong = c.getItemMaxLength() != null && s.length() > c.getItemMaxLength();
            if (tooShort || tooLong) {
                return ValidationOutcome.invalid(list, ConstraintViolation.ITEM_LENGTH,
                        "Each item must be between " + c.getItemMinLength() + " and "
                                + c.getItemMaxLength() + " characters").withConstraintHint(hint);
            }
        }
        return ValidationOutcome.valid(List.copyOf(list));
    }

    private String listHint(FormFieldSpec field) {
        FieldConstraints c = field.constraints();
        StringBuilder hint = new StringBuilder("A list of ");
        if (c.getMinItems() != null && c.getMaxItems() != null) {
            hint.append(c.getMinItems()).append('-').append(c.getMaxItems()).append(' ');
        }
        hint.append(field.label());
        if (c.getItemMinLength() != null && c.getItemMaxLength() != null) {
            hint.append(", each between ").append(c.getItemMinLength()).append('-')
                    .append(c.getItemMaxLength()).append(" characters");
        }
        return hint.toString();
    }

    private String normalizeSpoken(String value) {
        String normalized = SPOKEN_AT.matcher(value).replaceAll("@");
        normalized = SPOKEN_DOT.matcher(normalized).replaceAll(".");
        return normalized.replace(" ", "").toLowerCase(Locale.ROOT);
    }
}

package com.github.salilvnair.formassist.schema;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Constraint set of a single form field. Every bound is optional; a null bound is not checked.
 */
@Getter
@Builder
public class FieldConstraints {

    private final Integer minLength;
    private final Integer maxLength;
    private final Integer minValue;
    private final Integer maxValue;
    private final List<String> options;
    private final Integer minItems;
    private final Integer maxItems;
    private final Integer itemMinLength;
    private final Integer itemMaxLength;
    private final Pattern pattern;

    public static FieldConstraints none() {
        return FieldConstraints.builder().build();
    }

    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }

    public List<String> optionsOrEmpty() {
        return options == null ? List.of() : options;
    }

    /**
     * Human readable rules, used in extraction prompts.
     */
    public String summary() {
        List<String> rules = new ArrayList<>();
        if (minLength != null && maxLength != null) {
            rules.add("length between " + minLength + " and " + maxLength + " characters");
        }
        else if (maxLength != null) {
            rules.add("at most " + maxLength + " characters");
        }
        else if (minLength != null) {
            rules.add("at least " + minLength + " characters");
        }
        if (minValue != null && maxValue != null) {
            rules.add("number between " + minValue + " and " + maxValue);
        }
        if (hasOptions()) {
            rules.add("one of [" + String.join(", ", options) + "]");
        }
        if (minItems != null && maxItems != null) {
            rules.add(minItems + " to " + maxItems + " items");
        }
        if (itemMinLength != null && itemMaxLength != null) {
            rules.add("each item between " + itemMinLength + " and " + itemMaxLength + " characters");
        }
        if (pattern != null) {
            rules.add("must match pattern " + pattern.pattern());
        }
        return rules.isEmpty() ? "none" : String.join("; ", rules);
    }
}

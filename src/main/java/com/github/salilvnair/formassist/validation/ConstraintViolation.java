package com.github.salilvnair.formassist.validation;

public enum ConstraintViolation {
    MISSING_VALUE,
    TYPE_MISMATCH,
    MIN_LENGTH,
    MAX_LENGTH,
    MIN_VALUE,
    MAX_VALUE,
    NOT_IN_OPTIONS,
    INVALID_DATE,
    PATTERN_MISMATCH,
    MIN_ITEMS,
    MAX_ITEMS,
    ITEM_LENGTH
}

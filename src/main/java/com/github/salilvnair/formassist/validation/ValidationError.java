package com.github.salilvnair.formassist.validation;

public record ValidationError(
        ConstraintViolation violation,
        String message
) {}

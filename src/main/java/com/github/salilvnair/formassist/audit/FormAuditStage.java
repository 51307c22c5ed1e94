package com.github.salilvnair.formassist.audit;

public enum FormAuditStage {
    SESSION_STARTED,
    USER_INPUT,
    INPUT_UNUSABLE,
    INTENT_EXTRACTED,
    VALUE_VALIDATED,
    VALUE_CONFIRMED,
    VALUE_DENIED,
    FIELD_SKIPPED,
    SKIP_REJECTED,
    FORM_COMPLETED,
    STEP_ENTER,
    STEP_EXIT,
    STEP_ERROR,
    TURN_FAILED,
    ENGINE_KNOWN_FAILURE,
    ENGINE_UNKNOWN_FAILURE;

    public String value() {
        return name();
    }
}

package com.github.salilvnair.formassist.engine.constants;

public final class FormPayloadKey {

    public static final String STEP = "step";
    public static final String STEP_CLASS = "stepClass";
    public static final String META = "_meta";
    public static final String FIELD = "field";
    public static final String USER_TEXT = "userText";
    public static final String INTENT = "intent";
    public static final String VALUE = "value";
    public static final String CONFIDENCE = "confidence";
    public static final String SOURCE = "source";
    public static final String REASONING = "reasoning";
    public static final String VALID = "valid";
    public static final String ERROR = "error";
    public static final String ATTEMPTS = "attempts";
    public static final String CONFIRMATION_PENDING = "confirmationPending";
    public static final String FINAL_OUTPUT = "finalOutput";
    public static final String ERROR_CODE = "errorCode";
    public static final String MESSAGE = "message";
    public static final String RECOVERABLE = "recoverable";
    public static final String EXCEPTION = "exception";

    private FormPayloadKey() {
    }
}

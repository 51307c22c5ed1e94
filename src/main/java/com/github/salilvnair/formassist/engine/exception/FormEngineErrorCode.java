package com.github.salilvnair.formassist.engine.exception;

public enum FormEngineErrorCode {

    // =========================
    // Session errors
    // =========================
    SESSION_NOT_FOUND(
            "No form session exists for the given id",
            false
    ),

    // =========================
    // LLM related errors
    // =========================
    LLM_NOT_CONFIGURED(
            "LLM API key is not configured",
            false
    ),

    LLM_CALL_FAILED(
            "LLM call failed",
            true
    ),

    LLM_TIMEOUT(
            "LLM call timed out",
            true
    ),

    LLM_INVALID_RESPONSE(
            "LLM returned invalid response",
            true
    ),

    // =========================
    // Pipeline errors
    // =========================
    PIPELINE_NO_REPLY(
            "Turn pipeline completed without an assistant reply",
            false
    ),

    DUPLICATE_ENGINE_STEP(
            "Duplicate engine step detected",
            false
    ),

    MISSING_TERMINAL_STEP(
            "Exactly one terminal step is required",
            false
    ),

    MISSING_DEPENDENT_STEP(
            "Engine step depends on a step that is not registered",
            false
    ),

    DAG_CYCLE(
            "Engine step ordering contains a cycle",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    FormEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}

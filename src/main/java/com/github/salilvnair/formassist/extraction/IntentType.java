package com.github.salilvnair.formassist.extraction;

import java.util.Locale;

public enum IntentType {
    PROVIDE_VALUE("provide_value"),
    CONFIRM("confirm"),
    DENY("deny"),
    REQUEST_HELP("request_help"),
    REQUEST_SKIP("request_skip"),
    OTHER("other");

    private final String code;

    IntentType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a wire code, returning null for anything outside the fixed set.
     */
    public static IntentType fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (IntentType value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}

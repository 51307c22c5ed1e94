package com.github.salilvnair.formassist.extraction;

public record ExtractedIntent(
        IntentType intent,
        Object value,
        double confidence,
        String reasoning,
        String source
) {

    public static final String SOURCE_LLM = "LLM";
    public static final String SOURCE_LEXICAL = "LEXICAL";
    public static final String SOURCE_FALLBACK = "FALLBACK";

    public static ExtractedIntent fallback(String reasoning) {
        return new ExtractedIntent(IntentType.OTHER, null, 0.0d, reasoning, SOURCE_FALLBACK);
    }

    public boolean is(IntentType type) {
        return intent == type;
    }
}

package com.github.salilvnair.formassist.extraction;

/**
 * Turns one user utterance into an intent and, where present, a candidate value for the current field.
 * Implementations never throw; backend trouble comes back as an {@link IntentType#OTHER} fallback.
 */
public interface ExtractionService {
    ExtractedIntent extract(ExtractionRequest request);
}

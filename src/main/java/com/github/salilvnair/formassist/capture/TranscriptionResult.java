package com.github.salilvnair.formassist.capture;

/**
 * Outcome of an audio capture handed over by the capture front end. Only {@code text} of a successful
 * capture ever reaches the dialogue engine.
 */
public record TranscriptionResult(
        boolean success,
        String text,
        String error
) {

    public static TranscriptionResult success(String text) {
        return new TranscriptionResult(true, text, null);
    }

    public static TranscriptionResult failure(String error) {
        return new TranscriptionResult(false, null, error);
    }
}

package com.github.salilvnair.formassist.engine.model;

import com.github.salilvnair.formassist.extraction.IntentType;

import java.util.List;

public record TurnResult(
        SessionState state,
        boolean usable,
        List<String> replies,
        IntentType intent,
        String error
) {

    public static TurnResult unusable(SessionState state, String error) {
        return new TurnResult(state, false, List.of(), null, error);
    }
}

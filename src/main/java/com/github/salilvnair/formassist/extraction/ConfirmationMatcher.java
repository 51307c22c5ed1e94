package com.github.salilvnair.formassist.extraction;

import com.github.salilvnair.formassist.config.FormAssistFlowConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lexical yes/no resolution used while a value awaits confirmation.
 */
@Component
@RequiredArgsConstructor
public class ConfirmationMatcher {

    private final FormAssistFlowConfig flowConfig;

    public boolean isAffirmative(String userText) {
        if (userText == null || userText.isBlank()) {
            return false;
        }
        return affirmativePattern().matcher(userText).find();
    }

    public ExtractedIntent resolve(String userText, Object pendingValue) {
        if (isAffirmative(userText)) {
            return new ExtractedIntent(IntentType.CONFIRM, pendingValue, 1.0d,
                    "Affirmative token found while awaiting confirmation", ExtractedIntent.SOURCE_LEXICAL);
        }
        return new ExtractedIntent(IntentType.DENY, null, 1.0d,
                "No affirmative token found while awaiting confirmation", ExtractedIntent.SOURCE_LEXICAL);
    }

    private Pattern affirmativePattern() {
        List<String> tokens = flowConfig.getAffirmativeTokens();
        if (tokens == null || tokens.isEmpty()) {
            // matches nothing
            return Pattern.compile("(?!)");
        }
        String alternation = tokens.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> Pattern.quote(t.trim()))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

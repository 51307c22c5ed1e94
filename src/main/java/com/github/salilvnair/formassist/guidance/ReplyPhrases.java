package com.github.salilvnair.formassist.guidance;

import lombok.experimental.UtilityClass;

@UtilityClass
public class ReplyPhrases {

    public static final String TROUBLE_PROCESSING =
            "I'm having trouble processing your input. Could you please try again?";

    public static final String ALREADY_COMPLETE =
            "The form is already complete. Restart the conversation if you'd like to fill in a new one.";

    public static String confirmPrompt(String label, String renderedValue) {
        return "I've captured that your " + label + " is: " + renderedValue + ". Is that correct?";
    }

    public static String saved(String label, String renderedValue) {
        return "Great! I've saved your " + label + ": " + renderedValue + ".";
    }

    public static String reAsk(String label) {
        return "I apologize for the misunderstanding. Let's try again. What is your " + label + "?";
    }

    public static String cannotSkip(String label) {
        return "I'm sorry, but " + label + " is a required field and cannot be skipped. "
                + "Could you please provide this information?";
    }

    public static String skipped(String label) {
        return "No problem, we can skip the " + label + " field.";
    }

    public static String notUnderstood(String label) {
        return "I'm sorry, I didn't quite catch that. Could you please repeat your " + label + "?";
    }
}

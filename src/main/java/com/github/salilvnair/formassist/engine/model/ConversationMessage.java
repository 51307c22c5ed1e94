package com.github.salilvnair.formassist.engine.model;

public record ConversationMessage(
        Speaker speaker,
        String text
) {

    public static ConversationMessage user(String text) {
        return new ConversationMessage(Speaker.USER, text);
    }

    public static ConversationMessage assistant(String text) {
        return new ConversationMessage(Speaker.ASSISTANT, text);
    }
}

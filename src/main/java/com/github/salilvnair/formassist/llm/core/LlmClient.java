package com.github.salilvnair.formassist.llm.core;

import com.github.salilvnair.formassist.engine.model.ConversationMessage;

import java.util.List;

public interface LlmClient {
    /**
     * Sends one chat exchange and returns the raw JSON text the model produced.
     */
    String generateJson(String systemPrompt, List<ConversationMessage> history, String userText);
}

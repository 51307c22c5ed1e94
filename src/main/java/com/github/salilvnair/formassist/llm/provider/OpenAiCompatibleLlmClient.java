package com.github.salilvnair.formassist.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.formassist.config.FormAssistLlmConfig;
import com.github.salilvnair.formassist.engine.exception.FormEngineErrorCode;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.ConversationMessage;
import com.github.salilvnair.formassist.engine.model.Speaker;
import com.github.salilvnair.formassist.llm.core.LlmClient;
import com.github.salilvnair.formassist.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for any OpenAI-compatible endpoint (Groq by default).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final FormAssistLlmConfig llmConfig;
    private final HttpClient llmHttpClient;

    @Override
    public String generateJson(String systemPrompt, List<ConversationMessage> history, String userText) {
        if (!llmConfig.hasApiKey()) {
            throw new FormEngineException(FormEngineErrorCode.LLM_NOT_CONFIGURED);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(completionsUrl()))
                .timeout(Duration.ofMillis(llmConfig.getRequestTimeoutMs()))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + llmConfig.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(
                        JsonUtil.toJson(requestBody(systemPrompt, history, userText))))
                .build();

        HttpResponse<String> response;
        try {
            response = llmHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException timeout) {
            throw new FormEngineException(FormEngineErrorCode.LLM_TIMEOUT,
                    "LLM call timed out after " + llmConfig.getRequestTimeoutMs() + "ms", timeout);
        } catch (IOException io) {
            throw new FormEngineException(FormEngineErrorCode.LLM_CALL_FAILED,
                    "LLM call failed due to IO error: " + io.getMessage(), io);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new FormEngineException(FormEngineErrorCode.LLM_CALL_FAILED, "LLM call interrupted", interrupted);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("LLM endpoint returned status {}", status);
            throw new FormEngineException(FormEngineErrorCode.LLM_CALL_FAILED,
                    "LLM call failed with status " + status)
                    .withMetaData(Map.of("status", status));
        }
        return extractContent(response.body());
    }

    Map<String, Object> requestBody(String systemPrompt, List<ConversationMessage> history, String userText) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        if (history != null) {
            for (ConversationMessage turn : history) {
                messages.add(message(turn.speaker() == Speaker.USER ? "user" : "assistant", turn.text()));
            }
        }
        messages.add(message("user", userText));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", llmConfig.getModel());
        body.put("temperature", llmConfig.getTemperature());
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", messages);
        return body;
    }

    /**
     * Pulls {@code choices[0].message.content} out of a chat-completions response body.
     */
    public String extractContent(String responseBody) {
        JsonNode root = JsonUtil.parseOrNull(responseBody);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new FormEngineException(FormEngineErrorCode.LLM_INVALID_RESPONSE,
                    "LLM response has no message content");
        }
        return content.asText().trim();
    }

    private String completionsUrl() {
        String base = llmConfig.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + COMPLETIONS_PATH;
    }

    private Map<String, String> message(String role, String content) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("role", role);
        m.put("content", content == null ? "" : content);
        return m;
    }
}

package com.github.salilvnair.formassist.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.formassist.llm.core.LlmClient;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import com.github.salilvnair.formassist.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.formassist.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LlmExtractionService implements ExtractionService {

    private final LlmClient llmClient;
    private final ThymeleafTemplateRenderer templateRenderer;
    private final ConfirmationMatcher confirmationMatcher;

    @Override
    public ExtractedIntent extract(ExtractionRequest request) {
        if (request.confirmationPending()) {
            return confirmationMatcher.resolve(request.userText(), request.pendingValue());
        }
        try {
            String systemPrompt = renderSystemPrompt(request.field());
            String raw = llmClient.generateJson(systemPrompt, request.history(), request.userText());
            return parse(raw);
        } catch (Exception e) {
            log.warn("Extraction failed for field {}: {}", request.field().name(), e.getMessage());
            return ExtractedIntent.fallback("Error occurred during extraction: " + e.getMessage());
        }
    }

    String renderSystemPrompt(FormFieldSpec field) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("field_name", field.name());
        vars.put("field_description", field.description());
        vars.put("field_type", field.type().displayName());
        vars.put("validation_rules", field.rulesSummary());
        return templateRenderer.render(ExtractionPromptTemplate.SYSTEM_PROMPT, vars);
    }

    /**
     * Parses the model reply. Any structural problem throws so that {@link #extract} falls back.
     */
    ExtractedIntent parse(String raw) {
        JsonNode root = JsonUtil.parseOrNull(JsonUtil.stripCodeFence(raw));
        if (!root.isObject()) {
            throw new IllegalArgumentException("Extraction reply is not a JSON object");
        }
        IntentType intent = IntentType.fromCode(root.path("intent").asText(null));
        if (intent == null) {
            throw new IllegalArgumentException("Unknown intent: " + root.path("intent"));
        }
        JsonNode confidenceNode = root.path("confidence");
        double confidence;
        if (confidenceNode.isMissingNode() || confidenceNode.isNull()) {
            confidence = 0.0d;
        } else if (confidenceNode.isNumber()) {
            confidence = confidenceNode.asDouble();
        } else {
            throw new IllegalArgumentException("Non-numeric confidence: " + confidenceNode);
        }
        if (!(confidence >= 0.0d && confidence <= 1.0d)) {
            throw new IllegalArgumentException("Confidence out of range: " + confidenceNode);
        }
        Object value = JsonUtil.toPlainValue(root.get("extracted_value"));
        String reasoning = root.hasNonNull("reasoning")
                ? root.get("reasoning").asText()
                : root.path("reason").asText(null);
        return new ExtractedIntent(intent, value, confidence, reasoning, ExtractedIntent.SOURCE_LLM);
    }
}

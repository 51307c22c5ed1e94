package com.github.salilvnair.formassist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "formassist.llm")
@Getter
@Setter
public class FormAssistLlmConfig {

    private String baseUrl = "https://api.groq.com/openai/v1";
    private String apiKey;
    private String model = "llama3-70b-8192";
    private double temperature = 0.7d;
    private long connectTimeoutMs = 5000L;
    private long requestTimeoutMs = 20000L;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}

package com.github.salilvnair.formassist.config;

import com.github.salilvnair.formassist.schema.FormSchema;
import com.github.salilvnair.formassist.schema.FormSchemaDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class FormAssistConfiguration {

    @Bean
    public FormSchema formSchema() {
        return FormSchemaDefinition.registrationForm();
    }

    @Bean
    public HttpClient llmHttpClient(FormAssistLlmConfig llmConfig) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(llmConfig.getConnectTimeoutMs()))
                .build();
    }
}

package com.github.salilvnair.formassist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "formassist.flow")
@Getter
@Setter
public class FormAssistFlowConfig {

    private int historyTurns = 5;
    private int escalationThreshold = 3;
    private double minConfidence = 0.3d;
    private List<String> affirmativeTokens = defaultAffirmativeTokens();

    private static List<String> defaultAffirmativeTokens() {
        return new ArrayList<>(List.of("yes", "correct", "right", "sure", "yeah", "yep", "yup"));
    }
}

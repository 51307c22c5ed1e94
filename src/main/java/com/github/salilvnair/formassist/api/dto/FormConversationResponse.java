package com.github.salilvnair.formassist.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class FormConversationResponse {

    private boolean success;
    private String sessionId;
    private String currentField;
    private boolean complete;
    private boolean confirmationPending;
    private boolean usable = true;
    private String intent;
    private List<String> replies;
    private Map<String, Object> fieldValues;
    private Map<String, Object> finalOutput;
    private String errorCode;
    private boolean recoverable;
    private String message;
}

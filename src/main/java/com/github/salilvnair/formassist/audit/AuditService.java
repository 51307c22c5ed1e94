package com.github.salilvnair.formassist.audit;

import com.github.salilvnair.formassist.util.JsonUtil;

import java.util.Map;

public interface AuditService {
    void audit(String stage, String sessionId, String payloadJson);

    default void audit(FormAuditStage stage, String sessionId, Map<String, ?> payload) {
        audit(stage.value(), sessionId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }
}

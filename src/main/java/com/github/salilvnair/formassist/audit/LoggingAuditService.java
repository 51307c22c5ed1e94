package com.github.salilvnair.formassist.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes one structured line per audit stage to the {@code formassist.audit} logger.
 */
@Service
public class LoggingAuditService implements AuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("formassist.audit");

    @Override
    public void audit(String stage, String sessionId, String payloadJson) {
        if (!AUDIT_LOG.isInfoEnabled()) {
            return;
        }
        String payload = payloadJson == null || payloadJson.isBlank() ? "{}" : payloadJson;
        AUDIT_LOG.info("stage={} sessionId={} payload={}", stage, sessionId, payload);
    }
}

package com.github.salilvnair.formassist.engine.factory;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.StepTiming;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.session.TurnSession;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records a {@link StepTiming} on the session and audits enter, exit and failure of the wrapped step.
 */
final class AuditedEngineStep implements EngineStep {

    private final EngineStep delegate;
    private final AuditService audit;

    AuditedEngineStep(EngineStep delegate, AuditService audit) {
        this.delegate = delegate;
        this.audit = audit;
    }

    @Override
    public StepResult execute(TurnSession session) {
        StepTiming timing = StepTiming.builder()
                .stepName(delegate.getClass().getSimpleName())
                .startedAtNs(System.nanoTime())
                .build();
        audit.audit(FormAuditStage.STEP_ENTER, session.getSessionId(), basePayload(session));

        StepResult result;
        try {
            result = delegate.execute(session);
        } catch (RuntimeException e) {
            finish(session, timing);
            timing.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
            audit.audit(FormAuditStage.STEP_ERROR, session.getSessionId(), failurePayload(timing, e));
            throw e;
        }

        finish(session, timing);
        timing.setSuccess(true);
        Map<String, Object> payload = basePayload(session);
        payload.put("outcome", result.getClass().getSimpleName());
        payload.put("durationMs", timing.getDurationMs());
        audit.audit(FormAuditStage.STEP_EXIT, session.getSessionId(), payload);
        return result;
    }

    private void finish(TurnSession session, StepTiming timing) {
        long now = System.nanoTime();
        timing.setEndedAtNs(now);
        timing.setDurationMs((now - timing.getStartedAtNs()) / 1_000_000);
        session.getStepTimings().add(timing);
    }

    private Map<String, Object> basePayload(TurnSession session) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(FormPayloadKey.FIELD, session.getCurrentField());
        meta.put(FormPayloadKey.CONFIRMATION_PENDING, session.isConfirmationPending());

        Map<String, Object> payload = stepIdentity();
        payload.put(FormPayloadKey.META, meta);
        return payload;
    }

    private Map<String, Object> failurePayload(StepTiming timing, RuntimeException e) {
        Map<String, Object> payload = stepIdentity();
        payload.put("durationMs", timing.getDurationMs());
        payload.put("errorType", e.getClass().getSimpleName());
        payload.put("errorMessage", String.valueOf(e.getMessage()));
        if (e instanceof FormEngineException engineException && engineException.getMetaData() != null) {
            payload.put("_errorMeta", engineException.getMetaData());
        }
        return payload;
    }

    private Map<String, Object> stepIdentity() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FormPayloadKey.STEP, delegate.getClass().getSimpleName());
        payload.put(FormPayloadKey.STEP_CLASS, delegate.getClass().getName());
        return payload;
    }
}

package com.github.salilvnair.formassist.engine.steps;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.constants.FormPayloadKey;
import com.github.salilvnair.formassist.engine.helper.FieldProgressionHelper;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.guidance.GuidanceComposer;
import com.github.salilvnair.formassist.schema.FormFieldSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluated after a value was committed. The form completes on the first commit that leaves every
 * required field filled; the summary is appended only on that transition.
 */
@Slf4j
@Component
@TerminalStep
@RequiredArgsConstructor
public class CompletionCheckStep implements EngineStep {

    private final FieldProgressionHelper progression;
    private final GuidanceComposer guidanceComposer;
    private final AuditService audit;

    @Override
    public StepResult execute(TurnSession session) {
        if (!session.isCommitted() || session.isComplete()) {
            return new StepResult.Continue();
        }
        Optional<FormFieldSpec> missing = progression.firstMissingRequired(session);
        if (missing.isPresent()) {
            if (session.isAtTerminalField()) {
                log.warn("Session {} ran past the last field with {} still missing", session.getSessionId(), missing.get().name());
                progression.moveTo(session, missing.get());
            }
            return new StepResult.Continue();
        }

        Map<String, Object> finalOutput = new LinkedHashMap<>();
        session.getFieldValues().forEach((field, value) -> {
            if (value != null) {
                finalOutput.put(field, value);
            }
        });
        session.setFinalOutput(finalOutput);
        session.setComplete(true);
        session.reply(guidanceComposer.composeSummary(finalOutput));
        audit.audit(FormAuditStage.FORM_COMPLETED, session.getSessionId(), Map.of(FormPayloadKey.FINAL_OUTPUT, finalOutput));
        return new StepResult.Continue();
    }
}

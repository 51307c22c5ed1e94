package com.github.salilvnair.formassist.engine.factory;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.audit.FormAuditStage;
import com.github.salilvnair.formassist.engine.exception.FormEngineException;
import com.github.salilvnair.formassist.engine.model.SessionState;
import com.github.salilvnair.formassist.engine.model.StepTiming;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import com.github.salilvnair.formassist.engine.pipeline.StepResult;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.formassist.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.formassist.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.formassist.engine.session.TurnSession;
import com.github.salilvnair.formassist.support.FormAssistFixtures;
import com.github.salilvnair.formassist.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.formassist.support.TestConstants.BOOM;
import static com.github.salilvnair.formassist.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.formassist.support.TestConstants.USER_TEXT_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class EnginePipelineFactoryTest {

    @Test
    void initBuildsDagOrderedPipeline() {
        List<String> calls = new ArrayList<>();
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(
                        new FinalAnnotatedStep(calls),
                        new SecondAnnotatedStep(calls),
                        new FirstAnnotatedStep(calls)
                ),
                auditNoop());

        factory.init();
        TurnSession session = newSession();
        factory.create().execute(session);

        assertEquals(List.of("first", "second", "terminal"), calls);
        assertEquals(3, session.getStepTimings().size());
    }

    @Test
    void formStepsAreOrderedForATurn() {
        FormAssistFixtures fixtures = new FormAssistFixtures(new ScriptedLlmClient());

        List<String> order = fixtures.pipelineFactory.orderByDag(fixtures.steps).stream()
                .map(s -> s.getClass().getSimpleName())
                .toList();

        assertEquals(List.of(
                "RecordUserInputStep",
                "CompletedFormStep",
                "IntentExtractionStep",
                "ConfirmationStep",
                "HelpRequestStep",
                "ProvideValueStep",
                "SkipRequestStep",
                "UnrecognizedInputStep",
                "CompletionCheckStep"
        ), order);
    }

    @Test
    void initThrowsWhenNoTerminalStepExists() {
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(new FirstAnnotatedStep(new ArrayList<>())),
                auditNoop());

        assertThrows(FormEngineException.class, factory::init);
    }

    @Test
    void initThrowsOnCycle() {
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(new CycleA(), new CycleB(), new ExplodingTerminalStep()),
                auditNoop());

        FormEngineException ex = assertThrows(FormEngineException.class, factory::init);
        assertEquals("DAG_CYCLE", ex.getErrorCode());
    }

    @Test
    void initThrowsWhenDependencyIsNotRegistered() {
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(new SecondAnnotatedStep(new ArrayList<>()), new FinalAnnotatedStep(new ArrayList<>())),
                auditNoop());

        FormEngineException ex = assertThrows(FormEngineException.class, factory::init);
        assertEquals("MISSING_DEPENDENT_STEP", ex.getErrorCode());
    }

    @Test
    void failingStepIsAuditedAndRethrown() {
        AuditService audit = auditNoop();
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(new ExplodingTerminalStep()), audit);
        factory.init();

        assertThrows(IllegalStateException.class, () -> factory.create().execute(newSession()));
        verify(audit).audit(eq(FormAuditStage.STEP_ERROR), eq(SESSION_ID), any(Map.class));
    }

    @Test
    void unconstrainedStepsRunInClassNameOrderBeforeTheTerminal() {
        EnginePipelineFactory factory = new EnginePipelineFactory(List.of(), auditNoop());

        List<String> order = factory.orderByDag(List.of(
                        new ExplodingTerminalStep(), new ZuluStep(), new AlphaStep()))
                .stream()
                .map(s -> s.getClass().getSimpleName())
                .toList();

        assertEquals(List.of("AlphaStep", "ZuluStep", "ExplodingTerminalStep"), order);
    }

    @Test
    void duplicateStepClassIsRejected() {
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(new AlphaStep(), new AlphaStep(), new ExplodingTerminalStep()),
                auditNoop());

        FormEngineException ex = assertThrows(FormEngineException.class, factory::init);
        assertEquals("DUPLICATE_ENGINE_STEP", ex.getErrorCode());
    }

    @Test
    void successfulStepIsAuditedOnEnterAndExit() {
        AuditService audit = auditNoop();
        EnginePipelineFactory factory = new EnginePipelineFactory(
                List.of(new FinalAnnotatedStep(new ArrayList<>()),
                        new SecondAnnotatedStep(new ArrayList<>()),
                        new FirstAnnotatedStep(new ArrayList<>())),
                audit);
        factory.init();

        TurnSession session = newSession();
        factory.create().execute(session);

        verify(audit, times(3)).audit(eq(FormAuditStage.STEP_ENTER), eq(SESSION_ID), any(Map.class));
        verify(audit, times(3)).audit(eq(FormAuditStage.STEP_EXIT), eq(SESSION_ID), any(Map.class));
        assertTrue(session.getStepTimings().stream().allMatch(StepTiming::isSuccess));
    }

    private AuditService auditNoop() {
        return mock(AuditService.class);
    }

    private TurnSession newSession() {
        return new TurnSession(SessionState.initial(SESSION_ID, "full_name", "Hello"), USER_TEXT_NAME);
    }

    private static final class FirstAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private FirstAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(TurnSession session) {
            calls.add("first");
            return new StepResult.Continue();
        }
    }

    @MustRunAfter(FirstAnnotatedStep.class)
    private static final class SecondAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private SecondAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(TurnSession session) {
            calls.add("second");
            return new StepResult.Continue();
        }
    }

    @TerminalStep
    @MustRunAfter(SecondAnnotatedStep.class)
    private static final class FinalAnnotatedStep implements EngineStep {
        private final List<String> calls;

        private FinalAnnotatedStep(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public StepResult execute(TurnSession session) {
            calls.add("terminal");
            session.reply("done");
            return new StepResult.Stop("done");
        }
    }

    @MustRunBefore(CycleB.class)
    private static final class CycleA implements EngineStep {
        @Override
        public StepResult execute(TurnSession session) {
            return new StepResult.Continue();
        }
    }

    @MustRunBefore(CycleA.class)
    private static final class CycleB implements EngineStep {
        @Override
        public StepResult execute(TurnSession session) {
            return new StepResult.Continue();
        }
    }

    private static final class AlphaStep implements EngineStep {
        @Override
        public StepResult execute(TurnSession session) {
            return new StepResult.Continue();
        }
    }

    private static final class ZuluStep implements EngineStep {
        @Override
        public StepResult execute(TurnSession session) {
            return new StepResult.Continue();
        }
    }

    @TerminalStep
    private static final class ExplodingTerminalStep implements EngineStep {
        @Override
        public StepResult execute(TurnSession session) {
            throw new IllegalStateException(BOOM);
        }
    }
}

package com.github.salilvnair.formassist.engine.factory;

import com.github.salilvnair.formassist.audit.AuditService;
import com.github.salilvnair.formassist.engine.pipeline.EnginePipeline;
import com.github.salilvnair.formassist.engine.pipeline.EngineStep;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the turn pipeline from every {@link EngineStep} bean, ordered by the step annotations and
 * wrapped so each execution is timed and audited.
 */
@RequiredArgsConstructor
@Component
public class EnginePipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(EnginePipelineFactory.class);

    private final List<EngineStep> discoveredSteps;
    private final AuditService audit;

    private EnginePipeline pipeline;

    @PostConstruct
    public void init() {
        List<EngineStep> ordered = orderByDag(discoveredSteps);
        log.info("Form assist pipeline order: {}", ordered.stream()
                .map(s -> s.getClass().getSimpleName())
                .collect(Collectors.joining(" -> ")));
        this.pipeline = new EnginePipeline(ordered.stream()
                .map(s -> (EngineStep) new AuditedEngineStep(s, audit))
                .toList());
    }

    public EnginePipeline create() {
        if (pipeline == null) {
            init();
        }
        return pipeline;
    }

    List<EngineStep> orderByDag(List<EngineStep> steps) {
        return StepDependencyGraph.sort(steps);
    }
}

package com.github.salilvnair.formassist.engine.pipeline.annotation;

import java.lang.annotation.*;

/**
 * Marks the step that always runs last in the turn pipeline.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TerminalStep {
}

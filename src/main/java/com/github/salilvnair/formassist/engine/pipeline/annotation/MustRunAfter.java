package com.github.salilvnair.formassist.engine.pipeline.annotation;

import com.github.salilvnair.formassist.engine.pipeline.EngineStep;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MustRunAfter {
    Class<? extends EngineStep>[] value();
}

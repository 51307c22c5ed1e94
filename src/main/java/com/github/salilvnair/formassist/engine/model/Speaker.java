package com.github.salilvnair.formassist.engine.model;

public enum Speaker {
    USER,
    ASSISTANT
}

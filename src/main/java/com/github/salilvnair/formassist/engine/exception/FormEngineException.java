package com.github.salilvnair.formassist.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class FormEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public FormEngineException(FormEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormEngineException(FormEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormEngineException(FormEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FormEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}

package com.github.salilvnair.formassist.api.dto;

import com.github.salilvnair.formassist.capture.TranscriptionResult;
import lombok.Data;

@Data
public class CaptureRequest {

    private boolean success;
    private String text;
    private String error;

    public TranscriptionResult toTranscriptionResult() {
        return new TranscriptionResult(success, text, error);
    }
}

package com.github.salilvnair.formassist.api.dto;

import lombok.Data;

@Data
public class FormMessageRequest {

    private String message;
}

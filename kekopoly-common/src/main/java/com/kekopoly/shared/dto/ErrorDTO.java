package com.kekopoly.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDTO(String code, String message, String requestId) {

    public ErrorDTO(String code, String message) {
        this(code, message, null);
    }
}

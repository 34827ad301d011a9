package com.example.rls.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
        boolean success,
        String message,
        Boolean enabled
) {
    public static OperationResult ok(String message) {
        return new OperationResult(true, message, null);
    }

    public static OperationResult toggled(boolean enabled) {
        return new OperationResult(true, null, enabled);
    }
}

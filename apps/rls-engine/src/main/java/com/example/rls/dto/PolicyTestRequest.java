package com.example.rls.dto;

import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserSecurityContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Preview of an unsaved policy against a simulated user.
 */
public record PolicyTestRequest(
        @NotNull RlsPolicy policy,
        @NotNull @Valid UserSecurityContext testUser,
        @NotBlank String tableName,
        String schemaName,
        String connectionId
) {
    public PolicyTestRequest {
        if (schemaName == null || schemaName.isBlank()) {
            schemaName = "public";
        }
    }
}

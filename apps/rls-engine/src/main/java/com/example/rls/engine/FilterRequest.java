package com.example.rls.engine;

import com.example.rls.model.UserSecurityContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A table read on behalf of a user, as seen by the query executor.
 */
public record FilterRequest(
        String connectionId,
        @NotBlank String schemaName,
        @NotBlank String tableName,
        @NotNull @Valid UserSecurityContext userContext
) {
    /**
     * Qualified table name used in logs and audit records.
     */
    public String objectId() {
        return schemaName + "." + tableName;
    }
}

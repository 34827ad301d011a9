package com.example.rls.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Target of a template application.
 *
 * @param schemaName defaults to {@code public}
 * @param roleIds    roles the new policy applies to; empty for every role
 */
public record ApplyTemplateRequest(
        @NotBlank String tableName,
        String schemaName,
        String connectionId,
        List<String> roleIds
) {}

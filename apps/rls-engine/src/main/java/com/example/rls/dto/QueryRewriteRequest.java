package com.example.rls.dto;

import com.example.rls.engine.FilterRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * SQL query to run against {@code request}'s table on behalf of its user.
 */
public record QueryRewriteRequest(
        @NotNull @Valid FilterRequest request,
        @NotBlank String query
) {}

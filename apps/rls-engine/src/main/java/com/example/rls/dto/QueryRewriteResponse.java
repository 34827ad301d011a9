package com.example.rls.dto;

import com.example.rls.model.FilterDecision;

public record QueryRewriteResponse(
        String query,
        FilterDecision decision
) {}

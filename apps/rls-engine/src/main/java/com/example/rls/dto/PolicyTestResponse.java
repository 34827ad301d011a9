package com.example.rls.dto;

import com.example.rls.model.FilterDecision;

public record PolicyTestResponse(
        boolean policyWouldApply,
        String whereClause,
        boolean accessDenied,
        String denialReason
) {
    /**
     * @param decision preview decision of a single policy
     */
    public static PolicyTestResponse from(FilterDecision decision) {
        return new PolicyTestResponse(
                !decision.policiesApplied().isEmpty(),
                decision.whereClause(),
                decision.accessDenied(),
                decision.denialReason());
    }
}

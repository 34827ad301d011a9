package com.example.rls.model;

import java.util.List;

/**
 * Final RLS decision handed to the query executor.
 *
 * @param hasFilters      whether {@code whereClause} must be applied to the query
 * @param whereClause     SQL predicate restricting visible rows, null when unrestricted
 * @param policiesApplied ids of the policies that contributed, in resolution order
 * @param accessDenied    whether the table must not be read at all
 * @param denialReason    machine-readable reason when denied
 */
public record FilterDecision(
        boolean hasFilters,
        String whereClause,
        List<String> policiesApplied,
        boolean accessDenied,
        String denialReason
) {
    public static final String NO_MATCHING_POLICY = "no_matching_policy";
    public static final String ENGINE_UNAVAILABLE = "engine_unavailable";

    public FilterDecision {
        policiesApplied = policiesApplied == null ? List.of() : List.copyOf(policiesApplied);
    }

    public static FilterDecision unrestricted(List<String> policiesApplied) {
        return new FilterDecision(false, null, policiesApplied, false, null);
    }

    public static FilterDecision filtered(String whereClause, List<String> policiesApplied) {
        return new FilterDecision(true, whereClause, policiesApplied, false, null);
    }

    public static FilterDecision denied(String reason) {
        return new FilterDecision(false, null, List.of(), true, reason);
    }
}

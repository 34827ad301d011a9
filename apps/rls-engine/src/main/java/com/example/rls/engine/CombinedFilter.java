package com.example.rls.engine;

import com.example.rls.compiler.FilterExpression;

import java.util.List;
import java.util.Set;

/**
 * Merged predicate of every policy applicable to one (table, user) pair; the unit the
 * decision cache stores.
 *
 * @param policyIds  applicable policies in resolution order; empty when none applied
 * @param expression OR of the policies' predicates
 * @param columns    columns referenced by any applicable policy
 */
public record CombinedFilter(
        List<String> policyIds,
        FilterExpression expression,
        Set<String> columns
) {
    private static final CombinedFilter NO_MATCH = new CombinedFilter(List.of(), FilterExpression.FALSE, Set.of());

    public CombinedFilter {
        policyIds = List.copyOf(policyIds);
        columns = Set.copyOf(columns);
    }

    public static CombinedFilter noMatch() {
        return NO_MATCH;
    }

    public boolean noPolicyMatched() {
        return policyIds.isEmpty();
    }

    /**
     * Whether some applicable policy grants every row.
     */
    public boolean isUnrestricted() {
        return !noPolicyMatched() && FilterExpression.TRUE.equals(expression);
    }
}

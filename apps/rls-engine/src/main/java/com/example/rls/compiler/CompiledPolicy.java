package com.example.rls.compiler;

import java.util.Set;

/**
 * A policy's condition tree compiled for one user.
 *
 * @param policyId   source policy
 * @param expression resolved predicate
 * @param columns    columns referenced by the policy's conditions
 */
public record CompiledPolicy(
        String policyId,
        FilterExpression expression,
        Set<String> columns
) {
    public CompiledPolicy {
        columns = Set.copyOf(columns);
    }
}

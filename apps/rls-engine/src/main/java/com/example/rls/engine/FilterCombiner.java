package com.example.rls.engine;

import com.example.rls.compiler.CompiledPolicy;
import com.example.rls.compiler.FilterExpression;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges compiled policies into one filter.
 *
 * <p>Policies are independent grants: a row is visible when it satisfies at least one
 * applicable policy, so predicates are combined with OR.
 */
@Component
public class FilterCombiner {

    @NonNull
    public CombinedFilter combine(@NonNull List<CompiledPolicy> compiled) {
        if (compiled.isEmpty()) {
            return CombinedFilter.noMatch();
        }
        Set<String> columns = new TreeSet<>();
        compiled.forEach(policy -> columns.addAll(policy.columns()));
        FilterExpression expression = FilterExpression.or(
                compiled.stream().map(CompiledPolicy::expression).toList());
        List<String> policyIds = compiled.stream().map(CompiledPolicy::policyId).toList();
        return new CombinedFilter(policyIds, expression, columns);
    }
}

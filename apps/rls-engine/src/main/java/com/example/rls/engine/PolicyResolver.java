package com.example.rls.engine;

import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserSecurityContext;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the enabled policies that apply to a table read.
 *
 * <p>A policy applies when every scope field it sets (connection, schema, table) equals the
 * request's, and its role list is empty or shares a role with the user. Results are ordered
 * by priority descending, then id. Priority only orders; it never hides a policy.
 */
@Component
public class PolicyResolver {

    static final Comparator<RlsPolicy> RESOLUTION_ORDER =
            Comparator.comparingInt(RlsPolicy::effectivePriority).reversed()
                    .thenComparing(RlsPolicy::id, Comparator.nullsLast(Comparator.naturalOrder()));

    @NonNull
    public List<RlsPolicy> resolve(@NonNull FilterRequest request, @NonNull Collection<RlsPolicy> policies) {
        return policies.stream()
                .filter(policy -> appliesTo(policy, request))
                .sorted(RESOLUTION_ORDER)
                .toList();
    }

    public boolean appliesTo(@NonNull RlsPolicy policy, @NonNull FilterRequest request) {
        if (!policy.enabled()) {
            return false;
        }
        if (!scopeMatches(policy.connectionId(), request.connectionId())
                || !scopeMatches(policy.schemaName(), request.schemaName())
                || !scopeMatches(policy.tableName(), request.tableName())) {
            return false;
        }
        return rolesMatch(policy, request.userContext());
    }

    private boolean scopeMatches(@Nullable String policyScope, @Nullable String requested) {
        return policyScope == null || policyScope.isBlank() || policyScope.equals(requested);
    }

    public boolean rolesMatch(@NonNull RlsPolicy policy, @NonNull UserSecurityContext user) {
        return policy.roleIds().isEmpty() || user.holdsAnyRole(policy.roleIds());
    }
}

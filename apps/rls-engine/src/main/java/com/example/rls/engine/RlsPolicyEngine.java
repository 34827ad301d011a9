package com.example.rls.engine;

import com.example.rls.cache.DecisionCache;
import com.example.rls.cache.DecisionCacheKey;
import com.example.rls.compiler.CompiledPolicy;
import com.example.rls.compiler.ConditionCompiler;
import com.example.rls.model.FilterDecision;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserSecurityContext;
import com.example.rls.snapshot.PolicySnapshot;
import com.example.rls.snapshot.PolicySnapshotHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row-level security engine.
 *
 * <p>Each evaluation reads a single {@link PolicySnapshot}, so a concurrent administrative
 * change is seen either entirely or not at all. Without a usable snapshot every request is
 * denied with {@link FilterDecision#ENGINE_UNAVAILABLE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RlsPolicyEngine {

    static final String PREVIEW_POLICY_ID = "preview";

    private final PolicySnapshotHolder snapshotHolder;
    private final PolicyResolver policyResolver;
    private final ConditionCompiler conditionCompiler;
    private final FilterCombiner filterCombiner;
    private final DecisionCache decisionCache;
    private final EnforcementGate enforcementGate;

    @NonNull
    public FilterDecision evaluate(String connectionId, @NonNull String schemaName, @NonNull String tableName,
                                   @NonNull UserSecurityContext userContext) {
        return evaluate(new FilterRequest(connectionId, schemaName, tableName, userContext));
    }

    @NonNull
    public FilterDecision evaluate(@NonNull FilterRequest request) {
        Optional<PolicySnapshot> usable = snapshotHolder.usable();
        if (usable.isEmpty()) {
            return enforcementGate.unavailable(request);
        }
        PolicySnapshot snapshot = usable.get();
        RlsConfiguration config = snapshot.config();
        if (!config.enabled()) {
            return enforcementGate.bypass(request, config, snapshot.generation());
        }
        CombinedFilter filter = combinedFilter(request, snapshot);
        return enforcementGate.enforce(request, filter, config, snapshot.generation());
    }

    /**
     * Whether {@code row} is visible to the request's user, evaluated in memory. Fails closed
     * without a usable snapshot; no audit record is written.
     */
    public boolean isRowVisible(@NonNull FilterRequest request, @NonNull Map<String, ?> row) {
        Optional<PolicySnapshot> usable = snapshotHolder.usable();
        if (usable.isEmpty()) {
            log.warn("No usable policy snapshot, hiding row of {}", request.objectId());
            return false;
        }
        PolicySnapshot snapshot = usable.get();
        if (!snapshot.config().enabled()) {
            return true;
        }
        return enforcementGate.permitsRow(combinedFilter(request, snapshot), snapshot.config(), row);
    }

    /**
     * Decision a single, possibly unsaved, policy would produce for the request. Scope and
     * enabled flag are ignored; the policy's role list still applies. Bypasses the cache and
     * the audit log.
     */
    @NonNull
    public FilterDecision preview(@NonNull RlsPolicy policy, @NonNull FilterRequest request) {
        RlsConfiguration config = snapshotHolder.current()
                .map(PolicySnapshot::config)
                .orElseGet(RlsConfiguration::defaults);
        RlsConfiguration enforcing = new RlsConfiguration(true, config.defaultDeny(), 0, false, false);
        RlsPolicy candidate = policy.id() == null || policy.id().isBlank() ? policy.withId(PREVIEW_POLICY_ID) : policy;
        CombinedFilter filter = policyResolver.rolesMatch(candidate, request.userContext())
                ? filterCombiner.combine(List.of(conditionCompiler.compile(candidate, request.userContext())))
                : CombinedFilter.noMatch();
        return enforcementGate.decide(filter, enforcing);
    }

    private CombinedFilter combinedFilter(FilterRequest request, PolicySnapshot snapshot) {
        return decisionCache.getOrCompute(
                DecisionCacheKey.of(request),
                snapshot.generation(),
                snapshot.config().cacheTtlSeconds(),
                () -> compute(request, snapshot));
    }

    private CombinedFilter compute(FilterRequest request, PolicySnapshot snapshot) {
        List<RlsPolicy> applicable = policyResolver.resolve(request, snapshot.policies());
        List<CompiledPolicy> compiled = applicable.stream()
                .map(policy -> conditionCompiler.compile(policy, request.userContext()))
                .toList();
        CombinedFilter filter = filterCombiner.combine(compiled);
        log.debug("Resolved {} policies for {} and user {} at generation {}",
                filter.policyIds().size(), request.objectId(), request.userContext().userId(),
                snapshot.generation());
        return filter;
    }
}

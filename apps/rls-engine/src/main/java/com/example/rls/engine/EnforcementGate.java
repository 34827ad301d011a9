package com.example.rls.engine;

import com.example.rls.audit.RlsAuditEvent;
import com.example.rls.audit.RlsAuditService;
import com.example.rls.compiler.FilterSqlRenderer;
import com.example.rls.compiler.RowPredicateEvaluator;
import com.example.rls.model.FilterDecision;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.observability.RlsMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Turns a combined filter into the decision returned to the query executor, applying the
 * RLS configuration:
 * <ul>
 *   <li>{@code enabled=false}: unrestricted, no filter</li>
 *   <li>no applicable policy: denied only when {@code defaultDeny} is set</li>
 *   <li>otherwise the combined filter; {@code auditMode} hands back an unrestricted decision
 *       and records the enforced one in the audit log</li>
 * </ul>
 * With {@code logAccess} every evaluation is audited.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnforcementGate {

    private final RlsAuditService auditService;
    private final RlsMetricsService metricsService;
    private final Clock clock;

    /**
     * Decision with RLS switched off.
     */
    @NonNull
    public FilterDecision bypass(@NonNull FilterRequest request, @NonNull RlsConfiguration config, long generation) {
        FilterDecision decision = FilterDecision.unrestricted(List.of());
        metricsService.recordDecision("bypass");
        if (config.logAccess()) {
            auditService.logEvent(RlsAuditEvent.from(request, decision, List.of(), true, generation, clock.instant()));
        }
        return decision;
    }

    /**
     * Decision when no usable policy snapshot exists: fail closed.
     */
    @NonNull
    public FilterDecision unavailable(@NonNull FilterRequest request) {
        log.error("RLS engine unavailable, denying {} for user {}", request.objectId(), request.userContext().userId());
        metricsService.recordDecision("unavailable");
        auditService.logEvent(RlsAuditEvent.error(request, FilterDecision.ENGINE_UNAVAILABLE, clock.instant()));
        return FilterDecision.denied(FilterDecision.ENGINE_UNAVAILABLE);
    }

    @NonNull
    public FilterDecision enforce(@NonNull FilterRequest request, @NonNull CombinedFilter filter,
                                  @NonNull RlsConfiguration config, long generation) {
        FilterDecision decision = decide(filter, config);
        boolean auditOnly = config.auditMode();
        FilterDecision returned = auditOnly ? FilterDecision.unrestricted(decision.policiesApplied()) : decision;

        metricsService.recordDecision(auditOnly ? "audit" : outcomeTag(decision));
        if (config.logAccess() || auditOnly) {
            auditService.logEvent(RlsAuditEvent.from(
                    request, decision, filter.policyIds(), !auditOnly, generation, clock.instant()));
        }
        if (decision.accessDenied()) {
            log.debug("Access to {} denied for user {}: {}", request.objectId(),
                    request.userContext().userId(), decision.denialReason());
        }
        return returned;
    }

    /**
     * The enforced decision for {@code filter}, ignoring audit mode and without side effects.
     */
    @NonNull
    public FilterDecision decide(@NonNull CombinedFilter filter, @NonNull RlsConfiguration config) {
        if (!config.enabled()) {
            return FilterDecision.unrestricted(List.of());
        }
        if (filter.noPolicyMatched()) {
            return config.defaultDeny()
                    ? FilterDecision.denied(FilterDecision.NO_MATCHING_POLICY)
                    : FilterDecision.unrestricted(List.of());
        }
        if (filter.isUnrestricted()) {
            return FilterDecision.unrestricted(filter.policyIds());
        }
        return FilterDecision.filtered(FilterSqlRenderer.render(filter.expression()), filter.policyIds());
    }

    /**
     * In-memory counterpart of {@link #enforce}: whether the caller may see {@code row}.
     */
    public boolean permitsRow(@NonNull CombinedFilter filter, @NonNull RlsConfiguration config,
                              @NonNull Map<String, ?> row) {
        if (!config.enabled() || config.auditMode()) {
            return true;
        }
        if (filter.noPolicyMatched()) {
            return !config.defaultDeny();
        }
        return RowPredicateEvaluator.test(filter.expression(), row);
    }

    private String outcomeTag(FilterDecision decision) {
        if (decision.accessDenied()) {
            return "deny";
        }
        return decision.hasFilters() ? "filter" : "allow";
    }
}

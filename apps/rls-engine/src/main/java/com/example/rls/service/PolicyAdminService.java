package com.example.rls.service;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.exception.PolicyNotFoundException;
import com.example.rls.exception.PolicyValidationException;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;
import com.example.rls.snapshot.PolicySnapshot;
import com.example.rls.snapshot.PolicySnapshotHolder;
import com.example.rls.store.PolicyStore;
import com.example.rls.store.PolicyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Administration of policies, roles and the RLS configuration.
 *
 * <p>Every successful store write is published to the {@link PolicySnapshotHolder} as a new
 * generation, which also retires cached filters computed from the previous one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAdminService {

    static final String POLICY = "Policy";
    static final String ROLE = "Role";

    private final PolicyStore policyStore;
    private final PolicyValidator policyValidator;
    private final PolicySnapshotHolder snapshotHolder;
    private final Clock clock;

    // Policies

    /**
     * Lists policies. Each non-blank filter keeps policies whose field equals it or is unset,
     * since an unset scope field covers every value.
     */
    @NonNull
    public Flux<RlsPolicy> listPolicies(@Nullable String tableName, @Nullable String schemaName,
                                        @Nullable String connectionId) {
        return policyStore.listPolicies()
                .filter(policy -> matchesFilter(policy.tableName(), tableName)
                        && matchesFilter(policy.schemaName(), schemaName)
                        && matchesFilter(policy.connectionId(), connectionId));
    }

    @NonNull
    public Mono<RlsPolicy> getPolicy(@NonNull String id) {
        return policyStore.findPolicy(id)
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(POLICY, id)));
    }

    @NonNull
    public Mono<RlsPolicy> createPolicy(@NonNull RlsPolicy policy, @Nullable String createdBy) {
        Instant now = clock.instant();
        String id = policy.id() == null || policy.id().isBlank() ? UUID.randomUUID().toString() : policy.id();
        RlsPolicy prepared = policy.withId(id).withAudit(now, now, createdBy);
        return validated(prepared)
                .flatMap(policyStore::savePolicy)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withPolicy(saved));
                    log.info("Created RLS policy {} ({}) for table {}", saved.id(),
                            StringSanitizer.forLog(saved.name()), StringSanitizer.forLog(saved.tableName()));
                });
    }

    /**
     * Replaces a policy. The id, creation time and creator of the stored policy are kept.
     */
    @NonNull
    public Mono<RlsPolicy> updatePolicy(@NonNull String id, @NonNull RlsPolicy policy) {
        return getPolicy(id)
                .map(existing -> policy.withId(id)
                        .withAudit(existing.createdAt(), clock.instant(), existing.createdBy()))
                .flatMap(this::validated)
                .flatMap(policyStore::savePolicy)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withPolicy(saved));
                    log.info("Updated RLS policy {}", saved.id());
                });
    }

    @NonNull
    public Mono<Void> deletePolicy(@NonNull String id) {
        return policyStore.deletePolicy(id)
                .flatMap(removed -> {
                    if (!removed) {
                        return Mono.<Void>error(new PolicyNotFoundException(POLICY, id));
                    }
                    publish(snapshot -> snapshot.withoutPolicy(id));
                    log.info("Deleted RLS policy {}", id);
                    return Mono.<Void>empty();
                });
    }

    @NonNull
    public Mono<RlsPolicy> togglePolicy(@NonNull String id, boolean enabled) {
        return getPolicy(id)
                .map(existing -> existing.withEnabled(enabled, clock.instant()))
                .flatMap(policyStore::savePolicy)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withPolicy(saved));
                    log.info("RLS policy {} {}", id, enabled ? "enabled" : "disabled");
                });
    }

    // Roles

    @NonNull
    public Flux<SecurityRole> listRoles() {
        return policyStore.listRoles();
    }

    @NonNull
    public Mono<SecurityRole> getRole(@NonNull String id) {
        return policyStore.findRole(id)
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(ROLE, id)));
    }

    @NonNull
    public Mono<SecurityRole> createRole(@NonNull SecurityRole role) {
        Instant now = clock.instant();
        String id = role.id() == null || role.id().isBlank() ? UUID.randomUUID().toString() : role.id();
        return validatedRole(role.withId(id).withTimestamps(now, now))
                .flatMap(policyStore::saveRole)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withRole(saved));
                    log.info("Created security role {} ({})", saved.id(), StringSanitizer.forLog(saved.name()));
                });
    }

    @NonNull
    public Mono<SecurityRole> updateRole(@NonNull String id, @NonNull SecurityRole role) {
        return getRole(id)
                .map(existing -> role.withId(id).withTimestamps(existing.createdAt(), clock.instant()))
                .flatMap(this::validatedRole)
                .flatMap(policyStore::saveRole)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withRole(saved));
                    log.info("Updated security role {}", saved.id());
                });
    }

    /**
     * Deletes a role that no policy references.
     */
    @NonNull
    public Mono<Void> deleteRole(@NonNull String id) {
        return getRole(id)
                .thenMany(policyStore.listPolicies())
                .filter(policy -> policy.roleIds().contains(id))
                .map(RlsPolicy::id)
                .collectList()
                .flatMap(referencing -> {
                    if (!referencing.isEmpty()) {
                        return Mono.<Boolean>error(new PolicyValidationException(
                                "roleIds: role " + id + " is referenced by policies " + referencing));
                    }
                    return policyStore.deleteRole(id);
                })
                .flatMap(removed -> {
                    if (!removed) {
                        return Mono.<Void>error(new PolicyNotFoundException(ROLE, id));
                    }
                    publish(snapshot -> snapshot.withoutRole(id));
                    log.info("Deleted security role {}", id);
                    return Mono.<Void>empty();
                });
    }

    // Configuration

    @NonNull
    public Mono<RlsConfiguration> getConfig() {
        return policyStore.getConfig();
    }

    @NonNull
    public Mono<RlsConfiguration> updateConfig(@NonNull RlsConfiguration config) {
        return policyStore.saveConfig(config)
                .doOnNext(saved -> {
                    publish(snapshot -> snapshot.withConfig(saved));
                    log.info("RLS configuration updated: enabled={}, defaultDeny={}, cacheTtlSeconds={}, "
                                    + "logAccess={}, auditMode={}", saved.enabled(), saved.defaultDeny(),
                            saved.cacheTtlSeconds(), saved.logAccess(), saved.auditMode());
                });
    }

    private Mono<RlsPolicy> validated(RlsPolicy policy) {
        return policyStore.listRoles()
                .map(SecurityRole::id)
                .collect(Collectors.toSet())
                .map(knownRoleIds -> {
                    policyValidator.validate(policy, knownRoleIds);
                    return policy;
                });
    }

    private Mono<SecurityRole> validatedRole(SecurityRole role) {
        if (role.name() == null || role.name().isBlank()) {
            return Mono.error(new PolicyValidationException("name: must not be blank"));
        }
        return Mono.just(role);
    }

    private void publish(UnaryOperator<PolicySnapshot> change) {
        if (snapshotHolder.apply(change).isEmpty()) {
            log.warn("No policy snapshot loaded yet, change will be picked up by the next refresh");
        }
    }

    private boolean matchesFilter(@Nullable String value, @Nullable String filter) {
        return filter == null || filter.isBlank() || value == null || value.equals(filter);
    }
}

package com.example.rls.service;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.exception.PolicyValidationException;
import com.example.rls.model.SecurityRole;
import com.example.rls.model.UserRoleMapping;
import com.example.rls.store.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Role assignments per user. The authentication layer reads them when it builds a
 * user's security context.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserRoleService {

    private final PolicyStore policyStore;

    /**
     * Assignments of the user, an empty mapping when none were made.
     */
    @NonNull
    public Mono<UserRoleMapping> getUserRoles(@NonNull String userId) {
        return policyStore.findUserRoles(userId)
                .defaultIfEmpty(UserRoleMapping.empty(userId));
    }

    @NonNull
    public Mono<UserRoleMapping> setUserRoles(@NonNull String userId, @NonNull UserRoleMapping mapping) {
        UserRoleMapping prepared = mapping.withUserId(userId);
        return policyStore.listRoles()
                .map(SecurityRole::id)
                .collect(Collectors.toSet())
                .flatMap(knownRoleIds -> {
                    List<String> violations = new ArrayList<>();
                    prepared.roleIds().stream()
                            .filter(roleId -> !knownRoleIds.contains(roleId))
                            .forEach(roleId -> violations.add("roleIds: unknown role " + roleId));
                    if (prepared.effectiveFrom() != null && prepared.effectiveTo() != null
                            && prepared.effectiveTo().isBefore(prepared.effectiveFrom())) {
                        violations.add("effectiveTo: must not be before effectiveFrom");
                    }
                    if (!violations.isEmpty()) {
                        return Mono.<UserRoleMapping>error(new PolicyValidationException(violations));
                    }
                    return policyStore.saveUserRoles(prepared);
                })
                .doOnNext(saved -> log.info("Assigned roles {} to user {}",
                        saved.roleIds(), StringSanitizer.forLog(userId)));
    }
}

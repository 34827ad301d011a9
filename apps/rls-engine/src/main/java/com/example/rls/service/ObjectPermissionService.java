package com.example.rls.service;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.exception.PolicyValidationException;
import com.example.rls.model.ObjectPermission;
import com.example.rls.model.ObjectPermissions;
import com.example.rls.model.PermissionLevel;
import com.example.rls.model.SecurityRole;
import com.example.rls.model.UserSecurityContext;
import com.example.rls.store.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Object-level grants on dashboards, charts and datasets.
 *
 * <p>A user's effective level on an object is the strongest grant held directly or through
 * one of their roles, {@link PermissionLevel#NONE} when there is none.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObjectPermissionService {

    private final PolicyStore policyStore;

    @NonNull
    public Mono<ObjectPermissions> getPermissions(@NonNull String objectType, @NonNull String objectId,
                                                  @NonNull UserSecurityContext user) {
        return policyStore.findObjectPermissions(objectType, objectId)
                .collectList()
                .map(permissions -> new ObjectPermissions(
                        objectType, objectId, permissions, effectiveLevel(permissions, user)));
    }

    /**
     * Replaces every grant on the object. Each grant must name exactly one holder, and role
     * holders must exist.
     */
    @NonNull
    public Mono<List<ObjectPermission>> setPermissions(@NonNull String objectType, @NonNull String objectId,
                                                       @NonNull List<ObjectPermission> permissions) {
        List<ObjectPermission> normalized = permissions.stream()
                .map(permission -> permission.forObject(objectType, objectId))
                .toList();
        return policyStore.listRoles()
                .map(SecurityRole::id)
                .collect(Collectors.toSet())
                .flatMap(knownRoleIds -> {
                    List<String> violations = violations(normalized, knownRoleIds);
                    if (!violations.isEmpty()) {
                        return Mono.<List<ObjectPermission>>error(new PolicyValidationException(violations));
                    }
                    return policyStore.saveObjectPermissions(objectType, objectId, normalized);
                })
                .doOnNext(saved -> log.info("Set {} permissions on {}:{}", saved.size(),
                        StringSanitizer.forLog(objectType), StringSanitizer.forLog(objectId)));
    }

    static PermissionLevel effectiveLevel(List<ObjectPermission> permissions, UserSecurityContext user) {
        PermissionLevel effective = PermissionLevel.NONE;
        for (ObjectPermission permission : permissions) {
            if (permission.grantedTo(user) && permission.permissionLevel().compareTo(effective) > 0) {
                effective = permission.permissionLevel();
            }
        }
        return effective;
    }

    private List<String> violations(List<ObjectPermission> permissions, Set<String> knownRoleIds) {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < permissions.size(); i++) {
            ObjectPermission permission = permissions.get(i);
            boolean hasRole = permission.roleId() != null && !permission.roleId().isBlank();
            boolean hasUser = permission.userId() != null && !permission.userId().isBlank();
            if (hasRole == hasUser) {
                violations.add("permissions[" + i + "]: exactly one of roleId or userId required");
            } else if (hasRole && !knownRoleIds.contains(permission.roleId())) {
                violations.add("permissions[" + i + "]: unknown role " + permission.roleId());
            }
        }
        return violations;
    }
}

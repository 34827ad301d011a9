package com.example.rls.store;

import com.example.rls.model.ObjectPermission;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;
import com.example.rls.model.UserRoleMapping;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistence of policies, roles and the RLS configuration, plus object grants and user
 * role assignments.
 *
 * <p>Implementations are selected with {@code app.rls.store.type}. Callers publish every
 * successful write to the policy snapshot; the store itself knows nothing about evaluation.
 */
public interface PolicyStore {

    Flux<RlsPolicy> listPolicies();

    Mono<RlsPolicy> findPolicy(String id);

    /**
     * Insert or replace by id.
     */
    Mono<RlsPolicy> savePolicy(RlsPolicy policy);

    /**
     * @return true if a policy was removed
     */
    Mono<Boolean> deletePolicy(String id);

    Flux<SecurityRole> listRoles();

    Mono<SecurityRole> findRole(String id);

    Mono<SecurityRole> saveRole(SecurityRole role);

    Mono<Boolean> deleteRole(String id);

    Mono<RlsConfiguration> getConfig();

    Mono<RlsConfiguration> saveConfig(RlsConfiguration config);

    /**
     * Grants on one object, empty when none were set.
     */
    Flux<ObjectPermission> findObjectPermissions(String objectType, String objectId);

    /**
     * Replaces every grant on the object.
     */
    Mono<List<ObjectPermission>> saveObjectPermissions(String objectType, String objectId,
                                                       List<ObjectPermission> permissions);

    Mono<UserRoleMapping> findUserRoles(String userId);

    Mono<UserRoleMapping> saveUserRoles(UserRoleMapping mapping);
}

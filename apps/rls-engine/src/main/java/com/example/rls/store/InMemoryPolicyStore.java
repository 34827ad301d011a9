package com.example.rls.store;

import com.example.rls.config.properties.RlsProperties;
import com.example.rls.model.ObjectPermission;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;
import com.example.rls.model.UserRoleMapping;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory policy store for single-instance deployments and tests.
 *
 * <p>Contents are lost on restart; the configuration starts from {@code app.rls.defaults}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.rls.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPolicyStore implements PolicyStore {

    private final Map<String, RlsPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, SecurityRole> roles = new ConcurrentHashMap<>();
    private final Map<String, List<ObjectPermission>> objectPermissions = new ConcurrentHashMap<>();
    private final Map<String, UserRoleMapping> userRoles = new ConcurrentHashMap<>();
    private final AtomicReference<RlsConfiguration> config;

    public InMemoryPolicyStore(RlsProperties properties) {
        this.config = new AtomicReference<>(properties.defaults());
        log.info("In-memory policy store initialized (enabled={}, defaultDeny={}, auditMode={})",
                properties.defaults().enabled(), properties.defaults().defaultDeny(),
                properties.defaults().auditMode());
    }

    @Override
    @NonNull
    public Flux<RlsPolicy> listPolicies() {
        return Flux.fromStream(() -> policies.values().stream()
                .sorted(Comparator.comparing(RlsPolicy::id)));
    }

    @Override
    @NonNull
    public Mono<RlsPolicy> findPolicy(String id) {
        return Mono.justOrEmpty(policies.get(id));
    }

    @Override
    @NonNull
    public Mono<RlsPolicy> savePolicy(@NonNull RlsPolicy policy) {
        return Mono.fromCallable(() -> {
            policies.put(policy.id(), policy);
            log.debug("Stored policy {}", policy.id());
            return policy;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deletePolicy(String id) {
        return Mono.fromCallable(() -> policies.remove(id) != null);
    }

    @Override
    @NonNull
    public Flux<SecurityRole> listRoles() {
        return Flux.fromStream(() -> roles.values().stream()
                .sorted(Comparator.comparing(SecurityRole::id)));
    }

    @Override
    @NonNull
    public Mono<SecurityRole> findRole(String id) {
        return Mono.justOrEmpty(roles.get(id));
    }

    @Override
    @NonNull
    public Mono<SecurityRole> saveRole(@NonNull SecurityRole role) {
        return Mono.fromCallable(() -> {
            roles.put(role.id(), role);
            log.debug("Stored role {}", role.id());
            return role;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteRole(String id) {
        return Mono.fromCallable(() -> roles.remove(id) != null);
    }

    @Override
    @NonNull
    public Mono<RlsConfiguration> getConfig() {
        return Mono.fromSupplier(config::get);
    }

    @Override
    @NonNull
    public Mono<RlsConfiguration> saveConfig(@NonNull RlsConfiguration newConfig) {
        return Mono.fromCallable(() -> {
            config.set(newConfig);
            return newConfig;
        });
    }

    @Override
    @NonNull
    public Flux<ObjectPermission> findObjectPermissions(String objectType, String objectId) {
        return Flux.defer(() -> Flux.fromIterable(
                objectPermissions.getOrDefault(objectKey(objectType, objectId), List.of())));
    }

    @Override
    @NonNull
    public Mono<List<ObjectPermission>> saveObjectPermissions(String objectType, String objectId,
                                                              @NonNull List<ObjectPermission> permissions) {
        return Mono.fromCallable(() -> {
            List<ObjectPermission> stored = List.copyOf(permissions);
            objectPermissions.put(objectKey(objectType, objectId), stored);
            log.debug("Stored {} permissions for {}:{}", stored.size(), objectType, objectId);
            return stored;
        });
    }

    @Override
    @NonNull
    public Mono<UserRoleMapping> findUserRoles(String userId) {
        return Mono.justOrEmpty(userRoles.get(userId));
    }

    @Override
    @NonNull
    public Mono<UserRoleMapping> saveUserRoles(@NonNull UserRoleMapping mapping) {
        return Mono.fromCallable(() -> {
            userRoles.put(mapping.userId(), mapping);
            return mapping;
        });
    }

    private static String objectKey(String objectType, String objectId) {
        return objectType + ":" + objectId;
    }
}

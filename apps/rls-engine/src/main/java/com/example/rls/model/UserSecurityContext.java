package com.example.rls.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Security context of the requesting user, supplied by the authentication layer.
 *
 * @param userId     user identifier
 * @param username   login name
 * @param email      optional email
 * @param roles      ids of the roles the user currently holds; null or blank ids are dropped
 * @param attributes open attribute map used by dynamic conditions (department, region, custom keys)
 */
public record UserSecurityContext(
        @NotBlank String userId,
        String username,
        String email,
        Set<String> roles,
        Map<String, Object> attributes
) {
    public UserSecurityContext {
        roles = roles == null ? Set.of() : Collections.unmodifiableSet(roles.stream()
                .filter(roleId -> roleId != null && !roleId.isBlank())
                .collect(Collectors.<String, LinkedHashSet<String>>toCollection(LinkedHashSet::new)));
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean holdsAnyRole(Iterable<String> roleIds) {
        for (String roleId : roleIds) {
            if (roles.contains(roleId)) {
                return true;
            }
        }
        return false;
    }
}

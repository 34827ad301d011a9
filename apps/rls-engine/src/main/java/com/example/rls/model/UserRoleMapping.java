package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Roles assigned to a user, optionally bounded in time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserRoleMapping(
        String userId,
        List<String> roleIds,
        Instant effectiveFrom,
        Instant effectiveTo
) {
    public UserRoleMapping {
        roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
    }

    public static UserRoleMapping empty(String userId) {
        return new UserRoleMapping(userId, List.of(), null, null);
    }

    public UserRoleMapping withUserId(String newUserId) {
        return new UserRoleMapping(newUserId, roleIds, effectiveFrom, effectiveTo);
    }
}

package com.example.rls.model;

import java.util.List;

/**
 * Every grant on one object plus the strongest level the calling user holds.
 */
public record ObjectPermissions(
        String objectType,
        String objectId,
        List<ObjectPermission> permissions,
        PermissionLevel effectivePermission
) {
    public ObjectPermissions {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        if (effectivePermission == null) {
            effectivePermission = PermissionLevel.NONE;
        }
    }
}

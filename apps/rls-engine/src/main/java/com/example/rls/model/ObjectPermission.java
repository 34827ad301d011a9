package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One grant on an object, held either by a user or by a role.
 *
 * @param objectType      {@code dashboard}, {@code chart}, {@code dataset}, ...
 * @param permissionLevel defaults to {@link PermissionLevel#VIEW}
 * @param inherited       granted through a parent object
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectPermission(
        String objectType,
        String objectId,
        String roleId,
        String userId,
        PermissionLevel permissionLevel,
        boolean inherited
) {
    public ObjectPermission {
        if (permissionLevel == null) {
            permissionLevel = PermissionLevel.VIEW;
        }
    }

    public boolean grantedTo(UserSecurityContext user) {
        return (userId != null && userId.equals(user.userId()))
                || (roleId != null && user.roles().contains(roleId));
    }

    public ObjectPermission forObject(String newObjectType, String newObjectId) {
        return new ObjectPermission(newObjectType, newObjectId, roleId, userId, permissionLevel, inherited);
    }
}

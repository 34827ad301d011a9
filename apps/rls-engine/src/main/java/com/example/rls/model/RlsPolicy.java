package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Row-level security policy: a condition tree granting visibility to matching rows,
 * scoped to a table (optionally schema and connection) and to a set of roles.
 *
 * <p>Absent scope fields match every value; an empty {@code roleIds} list applies to every role.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RlsPolicy(
        String id,
        String name,
        String description,
        Boolean enabled,
        Integer priority,
        String schemaName,
        String tableName,
        String connectionId,
        ConditionGroup filterGroup,
        List<String> roleIds,
        Instant createdAt,
        Instant updatedAt,
        String createdBy
) {
    public RlsPolicy {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        roleIds = roleIds == null ? List.of() : List.copyOf(roleIds);
    }

    /**
     * Priority used for ordering; absent priority counts as zero.
     */
    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    public RlsPolicy withId(String newId) {
        return new RlsPolicy(newId, name, description, enabled, priority, schemaName, tableName,
                connectionId, filterGroup, roleIds, createdAt, updatedAt, createdBy);
    }

    public RlsPolicy withEnabled(boolean newEnabled, Instant now) {
        return new RlsPolicy(id, name, description, newEnabled, priority, schemaName, tableName,
                connectionId, filterGroup, roleIds, createdAt, now, createdBy);
    }

    public RlsPolicy withAudit(Instant newCreatedAt, Instant newUpdatedAt, String newCreatedBy) {
        return new RlsPolicy(id, name, description, enabled, priority, schemaName, tableName,
                connectionId, filterGroup, roleIds, newCreatedAt, newUpdatedAt, newCreatedBy);
    }
}

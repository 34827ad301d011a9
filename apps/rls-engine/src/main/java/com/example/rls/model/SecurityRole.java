package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Security role referenced by id from policies and user contexts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityRole(
        String id,
        String name,
        String description,
        @JsonProperty("isDefault") boolean defaultRole,
        Integer priority,
        Instant createdAt,
        Instant updatedAt
) {
    public SecurityRole withId(String newId) {
        return new SecurityRole(newId, name, description, defaultRole, priority, createdAt, updatedAt);
    }

    public SecurityRole withTimestamps(Instant newCreatedAt, Instant newUpdatedAt) {
        return new SecurityRole(id, name, description, defaultRole, priority, newCreatedAt, newUpdatedAt);
    }
}

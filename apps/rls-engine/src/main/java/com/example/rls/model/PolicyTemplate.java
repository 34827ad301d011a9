package com.example.rls.model;

/**
 * Reusable condition tree offered to administrators when creating a policy.
 */
public record PolicyTemplate(
        String id,
        String name,
        String description,
        ConditionGroup filterGroup
) {}

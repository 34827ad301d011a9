package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Access level granted on a dashboard, chart or dataset. Declared from weakest to strongest.
 */
public enum PermissionLevel {
    NONE("none"),
    VIEW("view"),
    EDIT("edit"),
    ADMIN("admin");

    private final String value;

    PermissionLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PermissionLevel fromValue(String value) {
        for (PermissionLevel level : values()) {
            if (level.value.equals(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown permission level: " + value);
    }
}

package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * User attributes a dynamic condition can reference.
 */
public enum UserAttributeType {
    USER_ID("user_id"),
    USERNAME("username"),
    EMAIL("email"),
    DEPARTMENT("department"),
    REGION("region"),
    ROLE("role"),
    TEAM("team"),
    CUSTOM("custom");

    private final String value;

    UserAttributeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static UserAttributeType fromValue(String value) {
        for (UserAttributeType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown user attribute: " + value);
    }
}

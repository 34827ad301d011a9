package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a condition's comparison value comes from.
 */
public enum FilterType {
    /** Fixed literal authored with the policy. */
    STATIC("static"),
    /** Resolved from the requesting user's attributes at evaluation time. */
    DYNAMIC("dynamic"),
    /** Trusted SQL fragment passed through verbatim. */
    EXPRESSION("expression");

    private final String value;

    FilterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FilterType fromValue(String value) {
        for (FilterType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter type: " + value);
    }
}

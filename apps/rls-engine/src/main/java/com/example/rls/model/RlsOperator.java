package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators available to a leaf condition.
 */
public enum RlsOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    BETWEEN("between"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null");

    private final String value;

    RlsOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Operators that test presence only and carry no comparison value.
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    @JsonCreator
    public static RlsOperator fromValue(String value) {
        for (RlsOperator operator : values()) {
            if (operator.value.equals(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown RLS operator: " + value);
    }
}

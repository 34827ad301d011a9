package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum GroupLogic {
    AND,
    OR;

    @JsonCreator
    public static GroupLogic fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AND;
        }
        return valueOf(value.trim().toUpperCase());
    }
}

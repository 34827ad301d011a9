package com.example.rls.compiler;

/**
 * Right-hand value of a condition after resolution.
 *
 * <p>{@link Unknown} stands for a dynamic attribute the user context does not carry. It is
 * a value, not an error: null checks remain meaningful against it and every other operator
 * evaluates to false.
 */
public sealed interface ResolvedValue permits ResolvedValue.Known, ResolvedValue.Unknown {

    ResolvedValue UNKNOWN = new Unknown();

    static ResolvedValue of(Object value) {
        return value == null ? UNKNOWN : new Known(value);
    }

    record Known(Object value) implements ResolvedValue {}

    record Unknown() implements ResolvedValue {}
}

package com.example.rls.exception;

import java.util.List;

/**
 * Thrown when a policy, role or configuration change is rejected at save time.
 */
public class PolicyValidationException extends RuntimeException {

    private final List<String> violations;

    public PolicyValidationException(List<String> violations) {
        super("Policy validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public PolicyValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}

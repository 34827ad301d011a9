package com.example.rls.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a caller asks to run a query against a table the RLS decision denies.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class RlsAccessDeniedException extends RuntimeException {

    private final String reason;

    public RlsAccessDeniedException(String reason) {
        super("Row-level security denied access: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

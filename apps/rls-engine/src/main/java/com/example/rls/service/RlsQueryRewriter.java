package com.example.rls.service;

import com.example.rls.exception.RlsAccessDeniedException;
import com.example.rls.model.FilterDecision;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link FilterDecision} to a SQL query by wrapping it in a filtering sub-select.
 *
 * <p>The query is treated as opaque text: only a trailing semicolon is removed.
 */
@Component
public class RlsQueryRewriter {

    static final String FILTERED_ALIAS = "__rls_filtered";

    /**
     * @return the query unchanged when the decision carries no filter, otherwise
     *         {@code SELECT * FROM (query) AS __rls_filtered WHERE <filter>}
     * @throws RlsAccessDeniedException when the decision denies access
     */
    @NonNull
    public String rewrite(@NonNull String query, @NonNull FilterDecision decision) {
        if (decision.accessDenied()) {
            throw new RlsAccessDeniedException(decision.denialReason());
        }
        if (!decision.hasFilters() || decision.whereClause() == null) {
            return query;
        }
        String inner = query.strip();
        while (inner.endsWith(";")) {
            inner = inner.substring(0, inner.length() - 1).stripTrailing();
        }
        return "SELECT * FROM (\n    " + inner + "\n) AS " + FILTERED_ALIAS + "\nWHERE " + decision.whereClause();
    }
}

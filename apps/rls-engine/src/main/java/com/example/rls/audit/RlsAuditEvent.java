package com.example.rls.audit;

import com.example.rls.engine.FilterRequest;
import com.example.rls.model.FilterDecision;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit record of one RLS evaluation.
 *
 * <p>{@code outcome} and the decision fields describe what the engine decided; {@code enforced}
 * is false when audit mode handed the caller an unrestricted decision instead.
 */
public record RlsAuditEvent(
        String eventId,
        Instant timestamp,
        Outcome outcome,
        boolean enforced,

        // Subject
        String userId,
        String username,

        // Object
        String connectionId,
        String objectId,

        // Decision
        List<String> policiesEvaluated,
        List<String> policiesApplied,
        String whereClause,
        String reason,
        long generation
) {
    public enum Outcome {
        ALLOW, FILTER, DENY, ERROR
    }

    public static RlsAuditEvent from(
            FilterRequest request,
            FilterDecision decision,
            List<String> policiesEvaluated,
            boolean enforced,
            long generation,
            Instant now) {

        return new RlsAuditEvent(
                UUID.randomUUID().toString(),
                now,
                outcomeOf(decision),
                enforced,
                request.userContext().userId(),
                request.userContext().username(),
                request.connectionId(),
                request.objectId(),
                policiesEvaluated,
                decision.policiesApplied(),
                decision.whereClause(),
                decision.denialReason(),
                generation
        );
    }

    public static RlsAuditEvent error(FilterRequest request, String reason, Instant now) {
        return new RlsAuditEvent(
                UUID.randomUUID().toString(),
                now,
                Outcome.ERROR,
                true,
                request.userContext().userId(),
                request.userContext().username(),
                request.connectionId(),
                request.objectId(),
                List.of(),
                List.of(),
                null,
                reason,
                -1
        );
    }

    private static Outcome outcomeOf(FilterDecision decision) {
        if (decision.accessDenied()) {
            return Outcome.DENY;
        }
        return decision.hasFilters() ? Outcome.FILTER : Outcome.ALLOW;
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "rls_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("enforced", enforced),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("username", username != null ? username : ""),
                Map.entry("connection_id", connectionId != null ? connectionId : ""),
                Map.entry("object_type", "table"),
                Map.entry("object_id", objectId != null ? objectId : ""),
                Map.entry("policies_evaluated", policiesEvaluated != null ? policiesEvaluated : List.of()),
                Map.entry("policies_applied", policiesApplied != null ? policiesApplied : List.of()),
                Map.entry("filters_applied", whereClause != null ? whereClause : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("generation", generation)
        );
    }
}

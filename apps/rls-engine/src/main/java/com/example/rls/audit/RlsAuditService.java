package com.example.rls.audit;

import com.example.rls.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Publishes RLS audit events as structured JSON on the {@code RLS_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
public class RlsAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("RLS_AUDIT");

    private final ObjectMapper objectMapper;

    public void logEvent(@NonNull RlsAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event, json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(RlsAuditEvent event, String json) {
        switch (event.outcome()) {
            case ALLOW, FILTER -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(RlsAuditEvent event) {
        AUDIT_LOG.warn("RLS {} - user={}, object={}, enforced={}, policies={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.userId()),
                StringSanitizer.forLog(event.objectId(), 128),
                event.enforced(),
                event.policiesApplied(),
                StringSanitizer.forLog(event.reason()));
    }
}

package com.example.rls.model;

/**
 * Process-wide RLS switches, replaced as a whole by administrators.
 *
 * @param enabled         false bypasses RLS entirely
 * @param defaultDeny     deny tables that no policy covers
 * @param cacheTtlSeconds lifetime of cached decisions; zero or less disables caching
 * @param logAccess       emit an audit record for every evaluation
 * @param auditMode       evaluate and log, but never restrict the caller
 */
public record RlsConfiguration(
        Boolean enabled,
        Boolean defaultDeny,
        Integer cacheTtlSeconds,
        Boolean logAccess,
        Boolean auditMode
) {
    public static final int DEFAULT_CACHE_TTL_SECONDS = 300;

    public RlsConfiguration {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (defaultDeny == null) {
            defaultDeny = Boolean.FALSE;
        }
        if (cacheTtlSeconds == null) {
            cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;
        }
        if (logAccess == null) {
            logAccess = Boolean.TRUE;
        }
        if (auditMode == null) {
            auditMode = Boolean.FALSE;
        }
    }

    public static RlsConfiguration defaults() {
        return new RlsConfiguration(true, false, DEFAULT_CACHE_TTL_SECONDS, true, false);
    }
}

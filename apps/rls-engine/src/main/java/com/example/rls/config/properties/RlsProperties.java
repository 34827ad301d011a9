package com.example.rls.config.properties;

import com.example.rls.model.RlsConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the RLS engine.
 *
 * <p>{@code defaults} seeds the RLS configuration of a fresh in-memory store; once loaded,
 * the configuration is owned by the store and changed through the admin API.
 */
@ConfigurationProperties(prefix = "app.rls")
public record RlsProperties(
        RlsConfiguration defaults,
        CacheProperties cache,
        SnapshotProperties snapshot
) {
    public RlsProperties {
        if (defaults == null) {
            defaults = RlsConfiguration.defaults();
        }
        if (cache == null) {
            cache = new CacheProperties(0);
        }
        if (snapshot == null) {
            snapshot = new SnapshotProperties(null, null);
        }
    }

    /**
     * Decision cache limits.
     */
    public record CacheProperties(
            int maxEntries
    ) {
        public CacheProperties {
            if (maxEntries <= 0) {
                maxEntries = 10000;
            }
        }
    }

    /**
     * Snapshot reload behaviour when the policy store is unreachable.
     *
     * @param maxStaleness how long the last good snapshot may be served after refreshes start failing
     * @param retry        backoff for a single refresh attempt
     */
    public record SnapshotProperties(
            Duration maxStaleness,
            RetryProperties retry
    ) {
        public SnapshotProperties {
            if (maxStaleness == null) {
                maxStaleness = Duration.ofMinutes(5);
            }
            if (retry == null) {
                retry = new RetryProperties(0, null, null);
            }
        }
    }

    public record RetryProperties(
            int maxAttempts,
            Duration initialBackoff,
            Duration maxBackoff
    ) {
        public RetryProperties {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(200);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(2);
            }
        }
    }

    public static RlsProperties withDefaults() {
        return new RlsProperties(null, null, null);
    }
}

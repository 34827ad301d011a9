package com.example.rls.cache;

import com.example.rls.config.properties.RlsProperties;
import com.example.rls.engine.CombinedFilter;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.observability.RlsMetricsService;
import com.example.rls.snapshot.PolicySnapshot;
import com.example.rls.snapshot.PolicySnapshotHolder;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Caffeine-backed cache of combined filters.
 *
 * <p>An entry is served only while it is younger than the configured TTL and was computed
 * from the current snapshot generation. Anything else counts as a miss and is evicted on
 * read; a scheduled sweep removes the rest. Entries hold the combined filter, never the
 * final decision, so configuration switches take effect immediately.
 */
@Slf4j
@Component
public class DecisionCache {

    static final String CACHE_NAME = "rls:decisions";

    private final Cache<DecisionCacheKey, Entry> cache;
    private final Clock clock;
    private final RlsMetricsService metricsService;
    private final PolicySnapshotHolder snapshotHolder;

    private record Entry(CombinedFilter filter, Instant capturedAt, long generation) {
    }

    public DecisionCache(RlsProperties properties, Clock clock, RlsMetricsService metricsService,
                         PolicySnapshotHolder snapshotHolder) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.cache().maxEntries())
                .build();
        this.clock = clock;
        this.metricsService = metricsService;
        this.snapshotHolder = snapshotHolder;
        metricsService.registerSizeGauge(CACHE_NAME);
        log.info("Decision cache initialized with max {} entries", properties.cache().maxEntries());
    }

    /**
     * Cached filter for {@code key}, or the result of {@code compute}, which is then stored
     * under {@code generation}. A TTL of zero or less bypasses the cache.
     */
    @NonNull
    public CombinedFilter getOrCompute(@NonNull DecisionCacheKey key, long generation, int ttlSeconds,
                                       @NonNull Supplier<CombinedFilter> compute) {
        if (ttlSeconds <= 0) {
            return compute.get();
        }
        Instant now = clock.instant();
        Entry entry = cache.getIfPresent(key);
        if (entry != null) {
            if (isFresh(entry, generation, ttlSeconds, now)) {
                metricsService.recordHit(CACHE_NAME);
                return entry.filter();
            }
            if (cache.asMap().remove(key, entry)) {
                metricsService.recordEviction(CACHE_NAME);
            }
        }
        metricsService.recordMiss(CACHE_NAME);
        CombinedFilter computed = compute.get();
        cache.put(key, new Entry(computed, now, generation));
        metricsService.updateSize(CACHE_NAME, cache.estimatedSize());
        return computed;
    }

    /**
     * Removes entries that are expired or belong to an older generation.
     *
     * @return number of entries removed
     */
    public int sweep(long currentGeneration, int ttlSeconds) {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<DecisionCacheKey, Entry> cached : cache.asMap().entrySet()) {
            if (!isFresh(cached.getValue(), currentGeneration, ttlSeconds, now)
                    && cache.asMap().remove(cached.getKey(), cached.getValue())) {
                removed++;
            }
        }
        metricsService.recordEvictions(CACHE_NAME, removed);
        metricsService.updateSize(CACHE_NAME, size());
        return removed;
    }

    @Scheduled(fixedDelayString = "${app.rls.cache.sweep-interval-ms:60000}")
    public void sweepStaleEntries() {
        PolicySnapshot snapshot = snapshotHolder.current().orElse(null);
        if (snapshot == null) {
            return;
        }
        RlsConfiguration config = snapshot.config();
        int removed = sweep(snapshot.generation(), config.cacheTtlSeconds());
        if (removed > 0) {
            log.debug("Swept {} stale decision cache entries", removed);
        }
    }

    /**
     * Entry count after pending maintenance, as reported to the size gauge.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private boolean isFresh(Entry entry, long generation, int ttlSeconds, Instant now) {
        return entry.generation() == generation
                && Duration.between(entry.capturedAt(), now).compareTo(Duration.ofSeconds(ttlSeconds)) < 0;
    }
}

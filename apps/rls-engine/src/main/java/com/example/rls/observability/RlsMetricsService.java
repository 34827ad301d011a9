package com.example.rls.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the decision cache, enforcement outcomes and snapshot refreshes.
 */
@Slf4j
@Service
public class RlsMetricsService {

    private static final String METRIC_PREFIX = "rls";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> hitCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> missCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> evictionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> sizeGauges = new ConcurrentHashMap<>();
    private final Counter refreshFailures;

    public RlsMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.refreshFailures = Counter.builder(METRIC_PREFIX + ".snapshot.refresh.failures")
                .description("Number of failed policy snapshot refreshes")
                .register(meterRegistry);
        log.info("RLS metrics service initialized");
    }

    public void recordHit(String cacheName) {
        counter(hitCounters, cacheName, ".cache.hits", "Number of cache hits").increment();
    }

    public void recordMiss(String cacheName) {
        counter(missCounters, cacheName, ".cache.misses", "Number of cache misses").increment();
    }

    public void recordEviction(String cacheName) {
        counter(evictionCounters, cacheName, ".cache.evictions", "Number of cache evictions").increment();
    }

    public void recordEvictions(String cacheName, int count) {
        if (count > 0) {
            counter(evictionCounters, cacheName, ".cache.evictions", "Number of cache evictions").increment(count);
        }
    }

    /**
     * Register a cache size gauge, updated through {@link #updateSize}.
     */
    public void registerSizeGauge(String cacheName) {
        sizeGauges.computeIfAbsent(cacheName, name -> {
            AtomicLong gauge = new AtomicLong(0);
            meterRegistry.gauge(METRIC_PREFIX + ".cache.size", Tags.of(TAG_CACHE_NAME, name), gauge, AtomicLong::get);
            log.debug("Registered size gauge for cache: {}", name);
            return gauge;
        });
    }

    public void updateSize(String cacheName, long size) {
        AtomicLong gauge = sizeGauges.get(cacheName);
        if (gauge != null) {
            gauge.set(size);
        }
    }

    /**
     * Record one evaluation outcome (allow, filter, deny, audit, bypass, unavailable).
     */
    public void recordDecision(String outcome) {
        decisionCounters.computeIfAbsent(outcome, key ->
                Counter.builder(METRIC_PREFIX + ".decisions")
                        .description("Number of RLS evaluations by outcome")
                        .tags(TAG_OUTCOME, key)
                        .register(meterRegistry)
        ).increment();
    }

    public void recordRefreshFailure() {
        refreshFailures.increment();
    }

    private Counter counter(ConcurrentHashMap<String, Counter> counters, String cacheName,
                            String suffix, String description) {
        return counters.computeIfAbsent(cacheName, key ->
                Counter.builder(METRIC_PREFIX + suffix)
                        .description(description)
                        .tags(TAG_CACHE_NAME, key)
                        .register(meterRegistry)
        );
    }
}

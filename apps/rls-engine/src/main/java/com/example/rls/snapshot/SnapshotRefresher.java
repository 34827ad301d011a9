package com.example.rls.snapshot;

import com.example.rls.config.properties.RlsProperties;
import com.example.rls.observability.RlsMetricsService;
import com.example.rls.store.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Loads policies, roles and configuration from the {@link PolicyStore} into the
 * {@link PolicySnapshotHolder}.
 *
 * <p>Each refresh is retried with exponential backoff. When it still fails the previous
 * snapshot stays in place; the holder stops serving it once it exceeds the staleness window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRefresher {

    private final PolicyStore policyStore;
    private final PolicySnapshotHolder snapshotHolder;
    private final RlsProperties properties;
    private final RlsMetricsService metricsService;

    /**
     * Loads the store and publishes the result. A load overtaken by an admin change is
     * reloaded once; if that one is overtaken too, the current snapshot stays as it is.
     */
    @NonNull
    public Mono<PolicySnapshot> refresh() {
        return loadAndPublish()
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Policy snapshot changed during load, reloading");
                    return loadAndPublish();
                }))
                .switchIfEmpty(Mono.defer(() -> Mono.justOrEmpty(snapshotHolder.current())))
                .doOnError(e -> {
                    metricsService.recordRefreshFailure();
                    log.error("Failed to refresh policy snapshot, keeping generation {}: {}",
                            snapshotHolder.generation(), e.getMessage());
                });
    }

    private Mono<PolicySnapshot> loadAndPublish() {
        RlsProperties.RetryProperties retry = properties.snapshot().retry();
        return Mono.defer(() -> {
            long baseGeneration = snapshotHolder.generation();
            return Mono.zip(
                            policyStore.listPolicies().collectList(),
                            policyStore.listRoles().collectList(),
                            policyStore.getConfig())
                    .retryWhen(Retry.backoff(retry.maxAttempts(), retry.initialBackoff())
                            .maxBackoff(retry.maxBackoff())
                            .doBeforeRetry(signal -> log.warn(
                                    "Retrying policy snapshot load, attempt {}: {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage())))
                    .flatMap(loaded -> Mono.justOrEmpty(snapshotHolder.replace(
                            baseGeneration, loaded.getT1(), loaded.getT2(), loaded.getT3())));
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadInitialSnapshot() {
        PolicySnapshot snapshot = refreshOrKeepCurrent();
        if (snapshot != null) {
            log.info("Initial policy snapshot loaded: generation={}, policies={}, roles={}",
                    snapshot.generation(), snapshot.policies().size(), snapshot.roles().size());
        }
    }

    @Scheduled(fixedDelayString = "${app.rls.snapshot.refresh-interval-ms:30000}",
            initialDelayString = "${app.rls.snapshot.refresh-interval-ms:30000}")
    public void scheduledRefresh() {
        refreshOrKeepCurrent();
    }

    /**
     * Runs one refresh; a failure has already been logged and counted, and the current
     * snapshot stays in service.
     */
    private PolicySnapshot refreshOrKeepCurrent() {
        return refresh()
                .onErrorResume(e -> Mono.justOrEmpty(snapshotHolder.current()))
                .block();
    }
}

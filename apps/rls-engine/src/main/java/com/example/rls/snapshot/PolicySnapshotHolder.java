package com.example.rls.snapshot;

import com.example.rls.config.properties.RlsProperties;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the current {@link PolicySnapshot}.
 *
 * <p>Readers take one snapshot per evaluation and never see a partial update. Every change
 * is published as a new snapshot with the next generation through a single atomic swap.
 */
@Slf4j
@Component
public class PolicySnapshotHolder {

    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>();
    private final Clock clock;
    private final Duration maxStaleness;

    public PolicySnapshotHolder(RlsProperties properties, Clock clock) {
        this.clock = clock;
        this.maxStaleness = properties.snapshot().maxStaleness();
    }

    @NonNull
    public Optional<PolicySnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * The current snapshot if it was confirmed against the store within the staleness window.
     */
    @NonNull
    public Optional<PolicySnapshot> usable() {
        PolicySnapshot snapshot = current.get();
        if (snapshot == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(snapshot.verifiedAt(), clock.instant());
        if (age.compareTo(maxStaleness) > 0) {
            log.warn("Policy snapshot generation {} is stale (age={}, max={})",
                    snapshot.generation(), age, maxStaleness);
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    /**
     * Current generation, or zero before the first load.
     */
    public long generation() {
        PolicySnapshot snapshot = current.get();
        return snapshot != null ? snapshot.generation() : 0L;
    }

    /**
     * Publishes the content loaded from the store. Unchanged content only refreshes
     * {@code verifiedAt}; changed content starts a new generation.
     *
     * @param baseGeneration generation current when the load started; if the snapshot has
     *                       moved on since, the load may predate an admin change and is discarded
     * @return the published snapshot, or empty when the load was discarded
     */
    @NonNull
    public Optional<PolicySnapshot> replace(long baseGeneration, List<RlsPolicy> policies,
                                            List<SecurityRole> roles, RlsConfiguration config) {
        Instant now = clock.instant();
        AtomicBoolean superseded = new AtomicBoolean();
        PolicySnapshot published = current.updateAndGet(existing -> {
            superseded.set(false);
            if (existing == null) {
                return new PolicySnapshot(policies, roles, config, 1L, now);
            }
            if (existing.generation() != baseGeneration) {
                superseded.set(true);
                return existing;
            }
            if (existing.sameContentAs(policies, roles, config)) {
                return existing.verified(now);
            }
            return existing.next(policies, roles, config, now);
        });
        if (superseded.get()) {
            log.debug("Discarding policy snapshot load based on generation {}, current is {}",
                    baseGeneration, published.generation());
            return Optional.empty();
        }
        log.debug("Policy snapshot generation {} published ({} policies, {} roles)",
                published.generation(), published.policies().size(), published.roles().size());
        return Optional.of(published);
    }

    /**
     * Applies an administrative change on top of the current snapshot and publishes it as
     * the next generation. Does nothing before the first load; the next refresh picks the
     * change up from the store.
     */
    @NonNull
    public Optional<PolicySnapshot> apply(@NonNull UnaryOperator<PolicySnapshot> change) {
        PolicySnapshot published = current.updateAndGet(existing -> {
            if (existing == null) {
                return null;
            }
            PolicySnapshot changed = change.apply(existing);
            return existing.next(changed.policies(), changed.roles(), changed.config(), existing.verifiedAt());
        });
        if (published != null) {
            log.debug("Policy snapshot generation {} published after admin change", published.generation());
        }
        return Optional.ofNullable(published);
    }
}

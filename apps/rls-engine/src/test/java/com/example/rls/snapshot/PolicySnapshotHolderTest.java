package com.example.rls.snapshot;

import com.example.rls.config.properties.RlsProperties;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.example.rls.util.PolicyTestBuilder.aPolicy;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PolicySnapshotHolder")
class PolicySnapshotHolderTest {

    private MutableClock clock;
    private PolicySnapshotHolder holder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        holder = new PolicySnapshotHolder(RlsProperties.withDefaults(), clock);
    }

    @Test
    @DisplayName("should have no usable snapshot before the first load")
    void shouldStartEmpty() {
        assertThat(holder.usable()).isEmpty();
        assertThat(holder.generation()).isZero();
    }

    @Test
    @DisplayName("should start at generation one and bump only on content changes")
    void shouldBumpGenerationOnChange() {
        RlsPolicy policy = aPolicy().build();

        assertThat(holder.replace(0L, List.of(policy), List.of(), RlsConfiguration.defaults()))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.generation()).isEqualTo(1));
        assertThat(holder.replace(1L, List.of(policy), List.of(), RlsConfiguration.defaults()))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.generation()).isEqualTo(1));
        assertThat(holder.replace(1L, List.of(), List.of(), RlsConfiguration.defaults()))
                .hasValueSatisfying(snapshot -> assertThat(snapshot.generation()).isEqualTo(2));
    }

    @Test
    @DisplayName("should stop serving a snapshot older than the staleness window")
    void shouldExpireStaleSnapshot() {
        holder.replace(holder.generation(), List.of(), List.of(), RlsConfiguration.defaults());

        clock.advance(Duration.ofMinutes(5));
        assertThat(holder.usable()).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(holder.usable()).isEmpty();
        assertThat(holder.current()).isPresent();
    }

    @Test
    @DisplayName("should refresh verifiedAt when the reloaded content is unchanged")
    void shouldRefreshVerifiedAt() {
        holder.replace(holder.generation(), List.of(), List.of(), RlsConfiguration.defaults());
        clock.advance(Duration.ofMinutes(4));
        holder.replace(holder.generation(), List.of(), List.of(), RlsConfiguration.defaults());
        clock.advance(Duration.ofMinutes(4));

        assertThat(holder.usable()).isPresent();
    }

    @Test
    @DisplayName("should publish admin changes as the next generation")
    void shouldPublishAdminChanges() {
        holder.replace(holder.generation(), List.of(), List.of(), RlsConfiguration.defaults());

        Optional<PolicySnapshot> published = holder.apply(snapshot -> snapshot.withPolicy(aPolicy().build()));

        assertThat(published).isPresent();
        assertThat(published.get().generation()).isEqualTo(2);
        assertThat(published.get().policies()).extracting(RlsPolicy::id).containsExactly("policy-1");
    }

    @Test
    @DisplayName("should discard a load that started before an admin change")
    void shouldDiscardLoadOvertakenByAdminChange() {
        holder.replace(0L, List.of(aPolicy().build()), List.of(), RlsConfiguration.defaults());
        long loadStartedAt = holder.generation();
        holder.apply(snapshot -> snapshot.withPolicy(aPolicy().disabled().build()));

        Optional<PolicySnapshot> result =
                holder.replace(loadStartedAt, List.of(aPolicy().build()), List.of(), RlsConfiguration.defaults());

        assertThat(result).isEmpty();
        assertThat(holder.generation()).isEqualTo(2);
        assertThat(holder.current()).hasValueSatisfying(snapshot ->
                assertThat(snapshot.policies()).extracting(RlsPolicy::enabled).containsExactly(false));
    }

    @Test
    @DisplayName("should ignore admin changes before the first load")
    void shouldIgnoreChangesBeforeLoad() {
        assertThat(holder.apply(snapshot -> snapshot.withPolicy(aPolicy().build()))).isEmpty();
        assertThat(holder.current()).isEmpty();
    }
}

package com.example.rls.config.properties;

import com.example.rls.model.RlsConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RlsProperties")
class RlsPropertiesTest {

    @Test
    @DisplayName("should fill every unset section with its defaults")
    void shouldApplyDefaults() {
        RlsProperties properties = RlsProperties.withDefaults();

        assertThat(properties.defaults()).isEqualTo(RlsConfiguration.defaults());
        assertThat(properties.cache().maxEntries()).isEqualTo(10000);
        assertThat(properties.snapshot().maxStaleness()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.snapshot().retry().maxAttempts()).isEqualTo(3);
        assertThat(properties.snapshot().retry().initialBackoff()).isEqualTo(Duration.ofMillis(200));
        assertThat(properties.snapshot().retry().maxBackoff()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("should keep the bootstrap configuration it was bound with")
    void shouldKeepBoundDefaults() {
        RlsConfiguration bound = new RlsConfiguration(true, true, 60, false, false);

        assertThat(new RlsProperties(bound, null, null).defaults()).isEqualTo(bound);
    }
}

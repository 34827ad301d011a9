package com.example.rls.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the RLS engine.
 */
@Configuration
public class RlsEngineConfig {

    /**
     * Clock used for cache freshness, snapshot staleness and audit timestamps.
     * Tests substitute a fixed or mutable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

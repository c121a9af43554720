package com.hivewatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class EngineConfiguration {

    /**
     * Wall clock used for idle sweeps, history windows and alert timestamps.
     * Tests substitute a fixed or mutable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

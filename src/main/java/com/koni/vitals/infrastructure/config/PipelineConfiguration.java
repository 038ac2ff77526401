package com.koni.vitals.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans of the pipeline.
 */
@Configuration
public class PipelineConfiguration {

    /**
     * UTC wall clock used by every worker. Tests replace it with a fixed or mutable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

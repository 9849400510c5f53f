package com.yoursp.faceapproval.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Enables @Scheduled methods (ticket sweep, session expiry) and exposes the
 * clock they and the stores read.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

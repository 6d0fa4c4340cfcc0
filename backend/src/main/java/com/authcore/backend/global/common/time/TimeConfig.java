package com.authcore.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single UTC clock source for token issuance, ledger timestamps and lockout windows.
 * Tests construct services with a fixed or mutable clock instead of this bean.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock authClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}

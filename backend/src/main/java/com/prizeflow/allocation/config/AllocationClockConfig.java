package com.prizeflow.allocation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AllocationClockConfig {

    @Bean
    public Clock allocationClock() {
        return Clock.systemUTC();
    }
}

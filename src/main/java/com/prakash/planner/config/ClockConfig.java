package com.prakash.planner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // The planner never reads the system clock itself; "now" comes from here
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

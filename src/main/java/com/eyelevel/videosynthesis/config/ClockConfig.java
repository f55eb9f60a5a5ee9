package com.eyelevel.videosynthesis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * UTC clock used for request timestamps and job bookkeeping. Replaced with a fixed clock in
     * tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.ridehub.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    // Single time source for event timestamps, event windows and pickup-time checks
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

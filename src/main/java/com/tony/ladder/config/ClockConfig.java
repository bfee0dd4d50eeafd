package com.tony.ladder.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // "Aujourd'hui" pour la machine à états des saisons (remplaçable en test)
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

package com.travelrevenue.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EngineSettings defaultEngineSettings(RevenueEngineProperties properties) {
        return properties.toSettings();
    }
}

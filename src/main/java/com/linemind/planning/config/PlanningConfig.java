package com.linemind.planning.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LineMindProperties.class)
public class PlanningConfig {

    @Bean
    public Clock planningClock() {
        return Clock.systemDefaultZone();
    }
}

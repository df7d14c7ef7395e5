package com.makeithappen.backend.daily.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DailyScheduleProperties.class)
public class DailyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

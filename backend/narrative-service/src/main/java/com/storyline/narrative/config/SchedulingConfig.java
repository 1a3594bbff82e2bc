package com.storyline.narrative.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * 모든 시간 계산의 기준 시계 (UTC)
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

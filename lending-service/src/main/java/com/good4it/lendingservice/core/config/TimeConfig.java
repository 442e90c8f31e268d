package com.good4it.lendingservice.core.config;

import com.good4it.lendingservice.service.period.PeriodCalculator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PeriodCalculator periodCalculator(@Value("${app.periods.zone:UTC}") String zone) {
        return new PeriodCalculator(ZoneId.of(zone));
    }
}

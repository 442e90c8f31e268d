package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.core.exception.InvalidLendingRequestException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public enum AnalyticsPeriod {
    LAST_7_DAYS("7d", Duration.ofDays(7)),
    LAST_30_DAYS("30d", Duration.ofDays(30)),
    LAST_90_DAYS("90d", Duration.ofDays(90)),
    LAST_YEAR("1y", Duration.ofDays(365)),
    ALL_TIME("all", null);

    private final String key;
    private final Duration window;

    AnalyticsPeriod(String key, Duration window) {
        this.key = key;
        this.window = window;
    }

    public String key() {
        return key;
    }

    // null for ALL_TIME
    public Instant since(Clock clock) {
        return window == null ? null : Instant.now(clock).minus(window);
    }

    public static AnalyticsPeriod fromKey(String key) {
        if (key == null) return LAST_30_DAYS;
        for (AnalyticsPeriod period : values()) {
            if (period.key.equalsIgnoreCase(key.trim())) {
                return period;
            }
        }
        throw new InvalidLendingRequestException(InvalidLendingRequestException.INVALID_PERIOD,
                "Period must be one of 7d, 30d, 90d, 1y or all");
    }
}

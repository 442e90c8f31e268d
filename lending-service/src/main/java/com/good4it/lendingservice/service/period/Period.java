package com.good4it.lendingservice.service.period;

import com.good4it.lendingservice.model.EmiFrequency;

import java.time.Instant;

// [start, endExclusive)
public record Period(EmiFrequency frequency, String key, Instant start, Instant endExclusive) {

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(endExclusive);
    }

    // Millisecond precision, persisted as the "paid up to" marker
    public Instant lastInstant() {
        return endExclusive.minusMillis(1);
    }
}

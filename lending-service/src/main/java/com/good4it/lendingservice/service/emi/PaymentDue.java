package com.good4it.lendingservice.service.emi;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record PaymentDue(
        UUID transactionId,
        PaymentDueStatus status,
        boolean paymentRequired,
        String periodKey,
        Instant periodStart,
        Instant periodEnd,
        Instant nextPeriodStart,
        BigDecimal installmentAmount
) {
}

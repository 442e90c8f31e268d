package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.TransactionStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record LendingSummaryResponse(
        BigDecimal totalRequested,
        BigDecimal totalLent,
        BigDecimal totalReceived,
        BigDecimal totalReturned,
        BigDecimal totalPending,
        BigDecimal totalForgiven,
        Counts counts,
        List<OpenBalance> toReturn,
        List<OpenBalance> toReceive
) {
    public record Counts(long requested, long lent, long received, long returned, long pending, long rejected,
                         long forgiven) {
    }

    public record OpenBalance(UUID transactionId, UUID counterpartyId, BigDecimal remaining,
                              TransactionStatus status, Instant openedAt) {

        public static OpenBalance owedTo(MoneyTransaction t) {
            return new OpenBalance(t.getId(), t.getLenderId(), t.remainingBalance(), t.getStatus(), t.getCreatedAt());
        }

        public static OpenBalance owedBy(MoneyTransaction t) {
            return new OpenBalance(t.getId(), t.getRequestorId(), t.remainingBalance(), t.getStatus(), t.getCreatedAt());
        }
    }
}

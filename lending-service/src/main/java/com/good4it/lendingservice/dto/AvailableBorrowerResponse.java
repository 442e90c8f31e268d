package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiDetails;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.PaymentType;
import com.good4it.lendingservice.model.TransactionStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record AvailableBorrowerResponse(
        UUID borrowerId,
        UUID transactionId,
        TransactionStatus status,
        BigDecimal originalAmount,
        BigDecimal repaidAmount,
        BigDecimal remainingAmount,
        PaymentType paymentType,
        EmiDetails emiDetails,
        Instant moneySentAt,
        Instant createdAt
) {
    public static AvailableBorrowerResponse from(MoneyTransaction t) {
        return new AvailableBorrowerResponse(
                t.getRequestorId(),
                t.getId(),
                t.getStatus(),
                t.getAmount(),
                t.getRepaymentAmount(),
                t.remainingBalance(),
                t.getPaymentType(),
                t.getEmiDetails(),
                t.getMoneySentAt(),
                t.getCreatedAt()
        );
    }
}

package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiDetails;
import com.good4it.lendingservice.model.ForgivenEmi;
import com.good4it.lendingservice.model.MoneyTransaction;
import com.good4it.lendingservice.model.PaymentType;
import com.good4it.lendingservice.model.TransactionStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TransactionResponse(
        UUID id,
        UUID requestId,
        UUID requestorId,
        UUID lenderId,
        BigDecimal amount,
        String description,
        TransactionStatus status,
        BigDecimal repaymentAmount,
        BigDecimal remainingBalance,
        BigDecimal forgivenAmount,
        PaymentType paymentType,
        EmiDetails emiDetails,
        List<ForgivenEmi> emiForgiveness,
        int totalForgivenEmis,
        Instant moneySentAt,
        Instant moneyReceivedAt,
        Instant repaymentSentAt,
        Instant repaymentReceivedAt,
        Instant repaymentRejectedAt,
        String repaymentRejectionReason,
        Instant forgivenAt,
        Instant createdAt
) {
    public static TransactionResponse from(MoneyTransaction t) {
        return new TransactionResponse(
                t.getId(),
                t.getRequestId(),
                t.getRequestorId(),
                t.getLenderId(),
                t.getAmount(),
                t.getDescription(),
                t.getStatus(),
                t.getRepaymentAmount(),
                t.remainingBalance(),
                t.getForgivenAmount(),
                t.getPaymentType(),
                t.getEmiDetails(),
                List.copyOf(t.getEmiForgiveness()),
                t.getTotalForgivenEmis(),
                t.getMoneySentAt(),
                t.getMoneyReceivedAt(),
                t.getRepaymentSentAt(),
                t.getRepaymentReceivedAt(),
                t.getRepaymentRejectedAt(),
                t.getRepaymentRejectionReason(),
                t.getForgivenAt(),
                t.getCreatedAt()
        );
    }
}

package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiDetails;
import com.good4it.lendingservice.model.MoneyRequest;
import com.good4it.lendingservice.model.PaymentType;
import com.good4it.lendingservice.model.RequestStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record MoneyRequestResponse(
        UUID id,
        UUID requestorId,
        UUID lenderId,
        BigDecimal amount,
        String description,
        PaymentType paymentType,
        EmiDetails emiDetails,
        RequestStatus status,
        String rejectionReason,
        Instant rejectedAt,
        Instant createdAt
) {
    public static MoneyRequestResponse from(MoneyRequest request) {
        return new MoneyRequestResponse(
                request.getId(),
                request.getRequestorId(),
                request.getLenderId(),
                request.getAmount(),
                request.getDescription(),
                request.getPaymentType(),
                request.getEmiDetails(),
                request.getStatus(),
                request.getRejectionReason(),
                request.getRejectedAt(),
                request.getCreatedAt()
        );
    }
}

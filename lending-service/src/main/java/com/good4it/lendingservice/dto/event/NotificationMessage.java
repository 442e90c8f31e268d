package com.good4it.lendingservice.dto.event;

import com.good4it.lendingservice.service.notification.NotificationEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record NotificationMessage(
        UUID recipientId,
        UUID senderId,
        NotificationEvent type,
        String title,
        String body,
        BigDecimal amount,
        UUID transactionId,
        UUID requestId,
        UUID taskId,
        Instant createdAt
) {
}

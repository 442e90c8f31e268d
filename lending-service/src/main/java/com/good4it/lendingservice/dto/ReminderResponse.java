package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.RepaymentReminder;

import java.time.Instant;
import java.util.UUID;

public record ReminderResponse(UUID id, UUID transactionId, UUID senderId, UUID recipientId, String message, Instant sentAt) {

    public static ReminderResponse from(RepaymentReminder reminder) {
        return new ReminderResponse(
                reminder.getId(),
                reminder.getTransactionId(),
                reminder.getSenderId(),
                reminder.getRecipientId(),
                reminder.getMessage(),
                reminder.getSentAt()
        );
    }
}

package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiForgivenessWindow;
import com.good4it.lendingservice.model.Task;
import com.good4it.lendingservice.model.TaskCategory;
import com.good4it.lendingservice.model.TaskPriority;
import com.good4it.lendingservice.model.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record TaskResponse(
        UUID id,
        String title,
        String description,
        TaskCategory category,
        TaskPriority priority,
        String location,
        Instant dueDate,
        UUID assignedBy,
        UUID assignedTo,
        UUID referenceTransactionId,
        BigDecimal monetaryValue,
        TaskStatus status,
        boolean emiTask,
        EmiForgivenessWindow emiForgiveness,
        String completionNotes,
        String confirmationNotes,
        BigDecimal amountRepaid,
        String declineReason,
        String cancellationReason,
        Instant completedAt,
        Instant confirmedAt,
        Instant createdAt
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getCategory(),
                task.getPriority(),
                task.getLocation(),
                task.getDueDate(),
                task.getAssignedBy(),
                task.getAssignedTo(),
                task.getReferenceTransactionId(),
                task.getMonetaryValue(),
                task.getStatus(),
                task.isEmiTask(),
                task.getEmiForgiveness(),
                task.getCompletionNotes(),
                task.getConfirmationNotes(),
                task.getAmountRepaid(),
                task.getDeclineReason(),
                task.getCancellationReason(),
                task.getCompletedAt(),
                task.getConfirmedAt(),
                task.getCreatedAt()
        );
    }
}

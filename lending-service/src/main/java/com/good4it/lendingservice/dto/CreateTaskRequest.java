package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.core.validation.ValidTaskRequest;
import com.good4it.lendingservice.model.TaskCategory;
import com.good4it.lendingservice.model.TaskPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@ValidTaskRequest
public record CreateTaskRequest(
        @NotBlank @Size(max = 100) String title,
        @Size(max = 500) String description,
        TaskCategory category,
        TaskPriority priority,
        @Size(max = 200) String location,
        @NotNull Instant dueDate,
        @NotNull UUID assignedTo,
        @NotNull UUID referenceTransactionId,
        @DecimalMin("0") @DecimalMax("10000") BigDecimal monetaryValue,
        boolean emiTask,
        @Valid EmiForgivenessRequest emiForgiveness
) {
}

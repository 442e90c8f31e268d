package com.good4it.lendingservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DecisionRequest(
        @NotNull Decision decision,
        @Size(max = 500) String rejectionReason
) {
}

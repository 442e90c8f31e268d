package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.DisputeOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ResolveDisputeRequest(
        @NotNull DisputeOutcome outcome,
        @Size(max = 1000) String notes
) {
}

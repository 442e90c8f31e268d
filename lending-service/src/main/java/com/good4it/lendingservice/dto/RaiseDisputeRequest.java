package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.DisputeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RaiseDisputeRequest(
        @NotNull DisputeType disputeType,
        @NotBlank @Size(max = 1000) String description
) {
}

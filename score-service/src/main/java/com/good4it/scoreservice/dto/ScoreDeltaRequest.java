package com.good4it.scoreservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;
import java.util.UUID;

public record ScoreDeltaRequest(
        @NotBlank String changeType,
        @NotNull @Min(-100) @Max(100) Integer scoreChange,
        @Size(max = 500) String description,
        Map<String, Object> metadata,
        UUID transactionId
) {
}

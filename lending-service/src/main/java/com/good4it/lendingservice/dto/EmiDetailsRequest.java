package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiDetails;
import com.good4it.lendingservice.model.EmiFrequency;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record EmiDetailsRequest(
        @NotNull @Min(1) @Max(24) Integer numberOfInstallments,
        @NotNull @Positive BigDecimal installmentAmount,
        @NotNull EmiFrequency frequency
) {
    public EmiDetails toEmbeddable() {
        return EmiDetails.builder()
                .numberOfInstallments(numberOfInstallments)
                .installmentAmount(installmentAmount)
                .frequency(frequency)
                .build();
    }
}

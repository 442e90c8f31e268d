package com.good4it.lendingservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record EmiForgivenessRequest(
        @NotNull @Min(1) @Max(24) Integer forgivenEmis,
        @Pattern(regexp = "\\d{4}-(0[1-9]|1[0-2])", message = "startMonth must be formatted as YYYY-MM") String startMonth
) {
}

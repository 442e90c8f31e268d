package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.core.validation.ValidMoneyRequest;
import com.good4it.lendingservice.model.PaymentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

@ValidMoneyRequest
public record CreateMoneyRequest(
        @NotNull UUID lenderId,
        @NotNull @DecimalMin("1") @DecimalMax("1000000") BigDecimal amount,
        @Size(max = 500) String description,
        PaymentType paymentType,
        @Valid EmiDetailsRequest emiDetails
) {
    public PaymentType paymentTypeOrDefault() {
        return paymentType == null ? PaymentType.FULL_PAYMENT : paymentType;
    }
}

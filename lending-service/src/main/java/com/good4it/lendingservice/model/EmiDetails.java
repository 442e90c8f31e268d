package com.good4it.lendingservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmiDetails {

    @Column(name = "emi_installments")
    private Integer numberOfInstallments;

    @Column(name = "emi_installment_amount", precision = 19, scale = 4)
    private BigDecimal installmentAmount;

    @Column(name = "emi_frequency", length = 20)
    @Enumerated(EnumType.STRING)
    private EmiFrequency frequency;
}

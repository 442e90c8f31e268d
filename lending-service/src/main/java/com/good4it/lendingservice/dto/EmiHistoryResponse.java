package com.good4it.lendingservice.dto;

import com.good4it.lendingservice.model.EmiDetails;
import com.good4it.lendingservice.model.ForgivenEmi;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record EmiHistoryResponse(
        UUID transactionId,
        EmiDetails emiDetails,
        BigDecimal amount,
        BigDecimal repaymentAmount,
        BigDecimal totalForgivenAmount,
        BigDecimal remainingBalance,
        int totalForgivenEmis,
        int remainingInstallments,
        List<ForgivenEmi> forgivenEmis
) {
}

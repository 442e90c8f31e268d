package com.good4it.lendingservice.service.emi;

import java.math.BigDecimal;
import java.util.List;

public record ReconciliationResult(
        BigDecimal credited,
        List<String> forgivenMonths,
        boolean settled
) {
}

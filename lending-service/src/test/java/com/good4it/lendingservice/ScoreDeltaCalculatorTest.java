package com.good4it.lendingservice;

import com.good4it.lendingservice.service.reputation.ScoreChangeType;
import com.good4it.lendingservice.service.reputation.ScoreDeltaCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreDeltaCalculatorTest {

    @Test
    @DisplayName("Without an amount the base delta is used")
    void testBaseDelta() {
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.TRANSACTION_COMPLETED, null, false)).isEqualTo(5);
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.FALSE_DISPUTE, BigDecimal.ZERO, false)).isEqualTo(-5);
    }

    @Test
    @DisplayName("Amounts scale the base delta up to one and a half times")
    void testAmountScaling() {
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.TRANSACTION_COMPLETED, new BigDecimal("1000"), false))
                .isEqualTo(5);
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.TRANSACTION_COMPLETED, new BigDecimal("500"), false))
                .isEqualTo(3);
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.TRANSACTION_COMPLETED, new BigDecimal("5000"), false))
                .isEqualTo(8);
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.FRAUDULENT_PROOF, new BigDecimal("2000"), false))
                .isEqualTo(-15);
    }

    @Test
    @DisplayName("Late flag only costs an extra point on a completed repayment")
    void testLatePenalty() {
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.REPAYMENT_COMPLETED, new BigDecimal("1000"), true))
                .isEqualTo(2);
        assertThat(ScoreDeltaCalculator.calculate(ScoreChangeType.LATE_REPAYMENT, new BigDecimal("1000"), true))
                .isEqualTo(-1);
    }
}

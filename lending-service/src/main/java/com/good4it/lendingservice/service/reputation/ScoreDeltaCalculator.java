package com.good4it.lendingservice.service.reputation;

import java.math.BigDecimal;

public final class ScoreDeltaCalculator {

    private static final double MAX_AMOUNT_MULTIPLIER = 1.5;
    private static final double AMOUNT_UNIT = 1000.0;

    private ScoreDeltaCalculator() {
    }

    /**
     * Base delta of {@code type}, scaled by {@code min(amount / 1000, 1.5)} when an amount is given and rounded
     * half up. A late {@code REPAYMENT_COMPLETED} loses one more point.
     */
    public static int calculate(ScoreChangeType type, BigDecimal amount, boolean late) {
        long change = type.baseDelta();

        if (amount != null && amount.signum() > 0) {
            double multiplier = Math.min(amount.doubleValue() / AMOUNT_UNIT, MAX_AMOUNT_MULTIPLIER);
            change = Math.round(change * multiplier);
        }

        if (late && type == ScoreChangeType.REPAYMENT_COMPLETED) {
            change -= 1;
        }

        return (int) change;
    }
}

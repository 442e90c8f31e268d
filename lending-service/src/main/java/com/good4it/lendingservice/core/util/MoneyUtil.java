package com.good4it.lendingservice.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtil {

    private MoneyUtil(){}

    public static final int SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public static final BigDecimal MIN_REQUEST_AMOUNT = BigDecimal.ONE;
    public static final BigDecimal MAX_REQUEST_AMOUNT = new BigDecimal("1000000");
    public static final BigDecimal MAX_TASK_VALUE = new BigDecimal("10000");

    public static BigDecimal format(BigDecimal amount) {
        if (amount == null) return BigDecimal.ZERO;
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    // Used in notification bodies, e.g. "$120.50"
    public static String display(BigDecimal amount) {
        if (amount == null) return "$0.00";
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}

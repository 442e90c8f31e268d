package com.good4it.lendingservice.service.reputation;

public enum ScoreChangeType {
    TRANSACTION_COMPLETED(5),
    REPAYMENT_COMPLETED(3),
    EARLY_REPAYMENT(2),
    FORGIVENESS_GIVEN(2),
    FORGIVENESS_RECEIVED(1),
    DISPUTE_RESOLVED(3),
    REQUEST_DECLINED(-2),
    PAYMENT_NOT_RECEIVED(-3),
    FALSE_DISPUTE(-5),
    LATE_REPAYMENT(-1),
    FRAUDULENT_PROOF(-10);

    private final int baseDelta;

    ScoreChangeType(int baseDelta) {
        this.baseDelta = baseDelta;
    }

    public int baseDelta() {
        return baseDelta;
    }
}

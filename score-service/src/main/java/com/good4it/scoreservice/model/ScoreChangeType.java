package com.good4it.scoreservice.model;

public enum ScoreChangeType {
    TRANSACTION_COMPLETED,
    REPAYMENT_COMPLETED,
    EARLY_REPAYMENT,
    FORGIVENESS_GIVEN,
    FORGIVENESS_RECEIVED,
    DISPUTE_RESOLVED,
    REQUEST_DECLINED,
    PAYMENT_NOT_RECEIVED,
    FALSE_DISPUTE,
    LATE_REPAYMENT,
    FRAUDULENT_PROOF
}

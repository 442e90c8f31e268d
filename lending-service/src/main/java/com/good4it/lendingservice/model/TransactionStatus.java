package com.good4it.lendingservice.model;

public enum TransactionStatus {
    MONEY_SENT,
    MONEY_RECEIVED,
    REPAYMENT_SENT,
    REPAID,
    FORGIVEN,
    REPAYMENT_REJECTED;

    public boolean isSettled() {
        return this == REPAID || this == FORGIVEN;
    }
}

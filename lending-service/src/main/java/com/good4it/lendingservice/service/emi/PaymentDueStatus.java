package com.good4it.lendingservice.service.emi;

public enum PaymentDueStatus {
    DUE(true),
    FORGIVEN_BY_TASK(false),
    ALREADY_PAID_THIS_PERIOD(false),
    ALREADY_SETTLED(false),
    NOT_EMI(true);

    private final boolean paymentRequired;

    PaymentDueStatus(boolean paymentRequired) {
        this.paymentRequired = paymentRequired;
    }

    public boolean paymentRequired() {
        return paymentRequired;
    }
}

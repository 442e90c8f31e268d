package com.good4it.lendingservice.model;

public enum DisputeType {
    PAYMENT_NOT_RECEIVED, PAYMENT_NOT_SENT, INCORRECT_AMOUNT, FRAUDULENT_PROOF
}

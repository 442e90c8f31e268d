package com.good4it.lendingservice.model;

public enum PaymentType {
    FULL_PAYMENT, EMI, INSTALLMENTS, FLEXIBLE
}

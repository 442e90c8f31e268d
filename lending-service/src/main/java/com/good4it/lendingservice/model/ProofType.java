package com.good4it.lendingservice.model;

public enum ProofType {
    MONEY_SENT, MONEY_RECEIVED, REPAYMENT_SENT, REPAYMENT_RECEIVED
}

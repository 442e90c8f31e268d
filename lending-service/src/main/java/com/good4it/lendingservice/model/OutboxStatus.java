package com.good4it.lendingservice.model;

public enum OutboxStatus {
    PENDING, PROCESSED, FAILED
}

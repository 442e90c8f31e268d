package com.good4it.lendingservice.model;

public enum DisputeStatus {
    PENDING, RESOLVED, REJECTED
}

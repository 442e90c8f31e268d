package com.good4it.lendingservice.model;

public enum RequestStatus {
    PENDING, APPROVED, REJECTED
}

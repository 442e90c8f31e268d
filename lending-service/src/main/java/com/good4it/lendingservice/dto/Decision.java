package com.good4it.lendingservice.dto;

public enum Decision {
    APPROVE,
    REJECT
}

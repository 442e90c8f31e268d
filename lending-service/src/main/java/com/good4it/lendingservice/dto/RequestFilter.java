package com.good4it.lendingservice.dto;

public enum RequestFilter {
    ALL,
    SENT,
    RECEIVED,
    REJECTED
}

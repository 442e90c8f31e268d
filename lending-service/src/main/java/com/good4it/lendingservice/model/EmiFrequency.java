package com.good4it.lendingservice.model;

public enum EmiFrequency {
    WEEKLY,
    MONTHLY,
    QUARTERLY
}

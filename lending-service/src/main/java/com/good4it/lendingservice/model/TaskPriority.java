package com.good4it.lendingservice.model;

public enum TaskPriority {
    LOW, MEDIUM, HIGH, URGENT
}

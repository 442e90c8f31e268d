package com.good4it.lendingservice.model;

public enum TaskCategory {
    HOUSEHOLD, MAINTENANCE, CLEANING, COOKING, SHOPPING, TRANSPORTATION, PERSONAL_CARE, PET_CARE, GARDEN, OTHER
}

package com.good4it.lendingservice.model;

public enum DisputeOutcome {
    IN_FAVOR_OF_DISPUTER, IN_FAVOR_OF_OTHER_PARTY, NO_FAULT
}

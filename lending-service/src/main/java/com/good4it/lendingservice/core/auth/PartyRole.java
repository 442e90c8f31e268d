package com.good4it.lendingservice.core.auth;

public enum PartyRole {
    LENDER,
    REQUESTOR,
    ASSIGNED_BY,
    ASSIGNED_TO
}

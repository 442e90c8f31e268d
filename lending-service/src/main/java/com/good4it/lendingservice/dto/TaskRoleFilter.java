package com.good4it.lendingservice.dto;

public enum TaskRoleFilter {
    ASSIGNED_TO_ME,
    ASSIGNED_BY_ME
}

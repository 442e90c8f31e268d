package com.good4it.lendingservice.model;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    ACCEPTED,
    IN_PROGRESS,
    COMPLETED,
    CONFIRMED,
    DECLINED,
    CANCELLED;

    // A task in any of these states still blocks a new task on the same transaction
    public static final Set<TaskStatus> OPEN = EnumSet.of(PENDING, ACCEPTED, IN_PROGRESS, COMPLETED);

    public static final Set<TaskStatus> CANCELLABLE = EnumSet.of(PENDING, ACCEPTED, IN_PROGRESS);

    public boolean isTerminal() {
        return !OPEN.contains(this);
    }
}

package com.good4it.lendingservice.service.notification;

import java.util.UUID;

public record NotificationRef(UUID transactionId, UUID requestId, UUID taskId) {

    public static NotificationRef request(UUID requestId) {
        return new NotificationRef(null, requestId, null);
    }

    public static NotificationRef transaction(UUID transactionId) {
        return new NotificationRef(transactionId, null, null);
    }

    public static NotificationRef task(UUID taskId, UUID transactionId) {
        return new NotificationRef(transactionId, null, taskId);
    }
}

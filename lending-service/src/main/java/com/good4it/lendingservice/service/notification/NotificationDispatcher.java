package com.good4it.lendingservice.service.notification;

import com.good4it.lendingservice.dto.event.NotificationMessage;

public interface NotificationDispatcher {

    void dispatch(NotificationMessage message);
}

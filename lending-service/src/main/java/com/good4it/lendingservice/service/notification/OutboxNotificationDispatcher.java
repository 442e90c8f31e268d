package com.good4it.lendingservice.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.good4it.lendingservice.dto.event.NotificationMessage;
import com.good4it.lendingservice.model.OutboxEvent;
import com.good4it.lendingservice.model.OutboxStatus;
import com.good4it.lendingservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@Slf4j
@RequiredArgsConstructor
public class OutboxNotificationDispatcher implements NotificationDispatcher {

    public static final String EVENT_TYPE = "NOTIFICATION_REQUESTED";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void dispatch(NotificationMessage message) {
        outboxRepository.save(OutboxEvent.builder()
                .aggregateId(message.recipientId().toString())
                .eventType(EVENT_TYPE)
                .payload(toJson(message))
                .status(OutboxStatus.PENDING)
                .createdAt(Instant.now())
                .build());

        log.debug("Queued {} notification for user {}", message.type(), message.recipientId());
    }

    private String toJson(NotificationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new SerializationFailedException("Cannot serialize notification " + message.type(), e);
        }
    }
}

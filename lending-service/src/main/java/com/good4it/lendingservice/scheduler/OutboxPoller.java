package com.good4it.lendingservice.scheduler;

import com.good4it.lendingservice.core.config.KafkaConfig;
import com.good4it.lendingservice.model.OutboxEvent;
import com.good4it.lendingservice.model.OutboxStatus;
import com.good4it.lendingservice.repository.OutboxRepository;
import com.good4it.lendingservice.service.notification.OutboxNotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

// Failed sends stay PENDING and are retried on the next run
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${app.outbox.batch-size:200}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:500}")
    @Transactional
    public void publishPending() {
        List<OutboxEvent> events = outboxRepository.findTopForProcessing(batchSize);

        if (events.isEmpty()) return;

        for (OutboxEvent event : events) {
            String topic = topicFor(event.getEventType());
            if (topic == null) {
                log.error("Outbox event {} has unknown type {}", event.getId(), event.getEventType());
                event.setStatus(OutboxStatus.FAILED);
                outboxRepository.save(event);
                continue;
            }

            try {
                kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                        .get(3, TimeUnit.SECONDS);

                event.setStatus(OutboxStatus.PROCESSED);
                outboxRepository.save(event);

                log.debug("Published outbox event {} to {}", event.getId(), topic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while publishing outbox event {}", event.getId());
                return;
            } catch (ExecutionException | TimeoutException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Failed to publish outbox event {}: {}", event.getId(), cause.getMessage());
            } catch (Exception e) {
                log.error("Unexpected error publishing outbox event {}", event.getId(), e);
            }
        }
    }

    private String topicFor(String eventType) {
        return switch (eventType) {
            case OutboxNotificationDispatcher.EVENT_TYPE -> KafkaConfig.NOTIFICATION_TOPIC;
            default -> null;
        };
    }
}

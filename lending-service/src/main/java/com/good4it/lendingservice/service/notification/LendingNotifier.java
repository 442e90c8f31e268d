package com.good4it.lendingservice.service.notification;

import com.good4it.lendingservice.client.SocialGraphGateway;
import com.good4it.lendingservice.core.util.MoneyUtil;
import com.good4it.lendingservice.dto.event.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

// Called after commit; never throws
@Component
@Slf4j
@RequiredArgsConstructor
public class LendingNotifier {

    private final NotificationDispatcher dispatcher;
    private final SocialGraphGateway socialGraph;
    private final Clock clock;

    public void notify(NotificationEvent event, UUID recipientId, UUID actorId, BigDecimal amount, NotificationRef ref) {
        notify(event, recipientId, actorId, amount, ref, null);
    }

    public void notify(NotificationEvent event, UUID recipientId, UUID actorId, BigDecimal amount,
                       NotificationRef ref, String detail) {
        try {
            String actorName = socialGraph.displayName(actorId);
            NotificationMessage message = new NotificationMessage(
                    recipientId,
                    actorId,
                    event,
                    event.title(),
                    event.render(actorName, MoneyUtil.display(amount), detail),
                    amount,
                    ref.transactionId(),
                    ref.requestId(),
                    ref.taskId(),
                    Instant.now(clock)
            );
            dispatcher.dispatch(message);
        } catch (Exception e) {
            log.warn("Failed to send {} notification to user {}: {}", event, recipientId, e.getMessage());
        }
    }
}

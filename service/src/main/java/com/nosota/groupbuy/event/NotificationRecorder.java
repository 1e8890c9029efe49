package com.nosota.groupbuy.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.groupbuy.model.NotificationLogEntry;
import com.nosota.groupbuy.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Records every {@link LedgerNotification} in the notification log and the service log.
 *
 * <p>Listeners run synchronously in the publishing thread, so the log entry shares the
 * emitting operation's transaction and disappears with it on rollback.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationRecorder {

    private final NotificationLogRepository notificationLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void onNotification(LedgerNotification notification) {
        NotificationLogEntry entry = new NotificationLogEntry();
        entry.setType(notification.type());
        entry.setOrderId(notification.orderId());
        entry.setParticipantId(notification.participantId());
        entry.setAmount(notification.amount());
        entry.setPayload(toJson(notification));
        entry.setCreatedAt(LocalDateTime.now(clock));
        notificationLogRepository.save(entry);

        log.info("Notification {}: orderId={}, participant={}, amount={}",
                notification.type(), notification.orderId(), notification.participantId(), notification.amount());
    }

    private String toJson(LedgerNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize notification " + notification.type(), e);
        }
    }
}

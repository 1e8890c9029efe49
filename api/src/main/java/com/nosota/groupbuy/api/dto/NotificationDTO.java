package com.nosota.groupbuy.api.dto;

import com.nosota.groupbuy.api.model.NotificationType;

import java.time.LocalDateTime;

/**
 * Notification emitted by the ledger.
 *
 * @param id            Sequence number (emission order)
 * @param type          Notification type
 * @param orderId       Order the notification refers to
 * @param participantId Participant involved (manufacturer or retailer), may be null
 * @param amount        Main amount carried by the notification, may be null
 * @param payload       Full notification as JSON
 * @param createdAt     Emission timestamp
 */
public record NotificationDTO(
        Long id,
        NotificationType type,
        Long orderId,
        String participantId,
        Long amount,
        String payload,
        LocalDateTime createdAt
) {
}

package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

/**
 * Notification emitted by the ledger for external observers and indexers.
 *
 * <p>Published as a Spring application event from inside the emitting operation and
 * recorded by {@link NotificationRecorder}. Each triggering event produces exactly one
 * notification; {@link PriceUpdated} and {@link OrderReadyForProcessing} may repeat
 * across joins of the same order.
 */
public interface LedgerNotification {

    NotificationType type();

    Long orderId();

    /**
     * Participant the notification concerns, if any.
     */
    default String participantId() {
        return null;
    }

    /**
     * Main amount carried by the notification, if any.
     */
    default Long amount() {
        return null;
    }
}

package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

/**
 * Emitted on every join after which the committed units meet the minimum.
 */
public record OrderReadyForProcessing(
        Long orderId,
        Long totalUnitsCommitted,
        Long minUnits
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.ORDER_READY_FOR_PROCESSING;
    }

    @Override
    public Long amount() {
        return totalUnitsCommitted;
    }
}

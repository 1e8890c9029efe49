package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record OrderCancelled(
        Long orderId,
        String cancelledBy,
        Long refundedTotal
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.ORDER_CANCELLED;
    }

    @Override
    public String participantId() {
        return cancelledBy;
    }

    @Override
    public Long amount() {
        return refundedTotal;
    }
}

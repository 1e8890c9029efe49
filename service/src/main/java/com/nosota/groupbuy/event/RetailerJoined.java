package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record RetailerJoined(
        Long orderId,
        String retailerId,
        Long units,
        Long amountPaid,
        Long totalUnitsCommitted
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.RETAILER_JOINED;
    }

    @Override
    public String participantId() {
        return retailerId;
    }

    @Override
    public Long amount() {
        return amountPaid;
    }
}

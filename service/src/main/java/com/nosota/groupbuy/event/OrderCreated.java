package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

import java.time.LocalDateTime;

public record OrderCreated(
        Long orderId,
        String manufacturerId,
        String productId,
        Long minUnits,
        Long initialPrice,
        Long stakeAmount,
        LocalDateTime deadline
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.ORDER_CREATED;
    }

    @Override
    public String participantId() {
        return manufacturerId;
    }

    @Override
    public Long amount() {
        return initialPrice;
    }
}

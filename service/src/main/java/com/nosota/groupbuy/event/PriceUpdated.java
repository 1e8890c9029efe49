package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record PriceUpdated(
        Long orderId,
        Long previousPrice,
        Long newPrice,
        Integer discountBps
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.PRICE_UPDATED;
    }

    @Override
    public Long amount() {
        return newPrice;
    }
}

package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record OrderProcessed(
        Long orderId,
        String manufacturerId,
        Long finalPricePerUnit,
        Long netPaymentToManufacturer,
        Long platformFeeCollected,
        Long refundsTotal,
        Long rewardPool
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.ORDER_PROCESSED;
    }

    @Override
    public String participantId() {
        return manufacturerId;
    }

    @Override
    public Long amount() {
        return netPaymentToManufacturer;
    }
}

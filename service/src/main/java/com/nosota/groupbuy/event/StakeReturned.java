package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record StakeReturned(
        Long orderId,
        String manufacturerId,
        Long stakeAmount
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.STAKE_RETURNED;
    }

    @Override
    public String participantId() {
        return manufacturerId;
    }

    @Override
    public Long amount() {
        return stakeAmount;
    }
}

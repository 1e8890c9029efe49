package com.nosota.groupbuy.event;

import com.nosota.groupbuy.api.model.NotificationType;

public record RewardsRecorded(
        Long orderId,
        String retailerId,
        Long rewardAmount
) implements LedgerNotification {

    @Override
    public NotificationType type() {
        return NotificationType.REWARDS_RECORDED;
    }

    @Override
    public String participantId() {
        return retailerId;
    }

    @Override
    public Long amount() {
        return rewardAmount;
    }
}

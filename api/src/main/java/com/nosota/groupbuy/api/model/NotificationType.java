package com.nosota.groupbuy.api.model;

public enum NotificationType {
    ORDER_CREATED,
    RETAILER_JOINED,
    PRICE_UPDATED,
    ORDER_READY_FOR_PROCESSING,
    ORDER_PROCESSED,
    STAKE_RETURNED,
    ORDER_CANCELLED,
    REWARDS_RECORDED,
    REWARD_CLAIMED
}

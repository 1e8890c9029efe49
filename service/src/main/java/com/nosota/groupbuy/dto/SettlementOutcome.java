package com.nosota.groupbuy.dto;

import com.nosota.groupbuy.api.model.OrderStatus;

/**
 * Settlement of an order together with the global parameters it was computed with.
 *
 * @param orderId        Order ID
 * @param result         Calculator output
 * @param rewardPool     floor(gross * rewardBps / 10000)
 * @param platformFeeBps Fee rate applied
 * @param rewardBps      Reward rate applied
 * @param status         FULFILLED once executed, OPEN for a preview
 */
public record SettlementOutcome(
        Long orderId,
        FulfillmentResult result,
        long rewardPool,
        int platformFeeBps,
        int rewardBps,
        OrderStatus status
) {
}

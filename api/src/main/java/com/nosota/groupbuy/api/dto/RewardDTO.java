package com.nosota.groupbuy.api.dto;

import java.time.LocalDateTime;

/**
 * Reward recorded for a retailer when an order was settled.
 *
 * @param orderId    Order ID
 * @param retailerId Retailer identifier
 * @param amount     Reward amount in reward-asset units
 * @param claimed    Whether the reward has been paid out
 * @param recordedAt Settlement timestamp
 * @param claimedAt  Claim timestamp (null until claimed)
 */
public record RewardDTO(
        Long orderId,
        String retailerId,
        Long amount,
        boolean claimed,
        LocalDateTime recordedAt,
        LocalDateTime claimedAt
) {
}

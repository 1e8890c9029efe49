package com.nosota.groupbuy.dto;

import com.nosota.groupbuy.model.DiscountTier;
import lombok.Builder;

import java.util.List;

/**
 * Internal DTO carrying the terms of an order to be created.
 *
 * @param productId       Opaque product identifier
 * @param minUnits        Minimum units threshold
 * @param initialPrice    Unit price before discount
 * @param discountTiers   Discount tiers (copied into the order)
 * @param stakeAmount     Manufacturer stake in reward-asset units
 * @param durationSeconds Seconds until the fulfillment deadline
 */
@Builder
public record NewOrder(
        String productId,
        long minUnits,
        long initialPrice,
        List<DiscountTier> discountTiers,
        long stakeAmount,
        long durationSeconds
) {
}

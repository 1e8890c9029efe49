package com.nosota.groupbuy.api.response;

import com.nosota.groupbuy.api.dto.DiscountTierDTO;
import com.nosota.groupbuy.api.model.OrderStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full state of a group-buy order.
 *
 * @param id                  Order ID
 * @param manufacturerId      Manufacturer identifier
 * @param productId           Product identifier
 * @param minUnits            Minimum units threshold
 * @param initialPrice        Unit price before discount
 * @param currentPrice        Discount-adjusted unit price
 * @param totalUnitsCommitted Sum of all contributions' units
 * @param totalValueCollected Sum of all contributions' payments
 * @param stakeAmount         Manufacturer stake
 * @param discountTiers       Frozen discount tiers
 * @param createdAt           Creation timestamp
 * @param deadline            Fulfillment deadline
 * @param active              Lifecycle flag: order accepts joins
 * @param fulfilled           Lifecycle flag: order has been settled
 * @param status              Status derived from the flags
 */
public record OrderResponse(
        Long id,
        String manufacturerId,
        String productId,
        Long minUnits,
        Long initialPrice,
        Long currentPrice,
        Long totalUnitsCommitted,
        Long totalValueCollected,
        Long stakeAmount,
        List<DiscountTierDTO> discountTiers,
        LocalDateTime createdAt,
        LocalDateTime deadline,
        boolean active,
        boolean fulfilled,
        OrderStatus status
) {
}

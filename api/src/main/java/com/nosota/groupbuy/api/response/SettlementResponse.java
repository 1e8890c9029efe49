package com.nosota.groupbuy.api.response;

import com.nosota.groupbuy.api.dto.RefundDTO;
import com.nosota.groupbuy.api.model.OrderStatus;

import java.util.List;

/**
 * Settlement figures of an order, either executed or previewed.
 *
 * @param orderId                  Order ID
 * @param finalPricePerUnit        Resolved unit price
 * @param grossValue               Total units times final price
 * @param netPaymentToManufacturer Gross value minus platform fee
 * @param platformFeeCollected     Platform fee
 * @param rewardPool               Reward pool funded for the order's retailers
 * @param platformFeeBps           Fee rate applied
 * @param rewardBps                Reward rate applied
 * @param refunds                  Refunds to retailers who paid above the final price
 * @param status                   FULFILLED after execution, OPEN for a preview
 */
public record SettlementResponse(
        Long orderId,
        Long finalPricePerUnit,
        Long grossValue,
        Long netPaymentToManufacturer,
        Long platformFeeCollected,
        Long rewardPool,
        Integer platformFeeBps,
        Integer rewardBps,
        List<RefundDTO> refunds,
        OrderStatus status
) {
}

package com.nosota.groupbuy.api.dto;

/**
 * Refund paid to a retailer at settlement.
 */
public record RefundDTO(
        String retailerId,
        Long amount
) {
}

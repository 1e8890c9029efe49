package com.nosota.groupbuy.dto;

/**
 * Refund owed to a retailer who prepaid more than the final price.
 */
public record RefundEntry(String retailerId, long amount) {
}

package com.nosota.groupbuy.dto;

import java.util.List;

/**
 * Output of the settlement calculation for a completed order. Transient, never persisted.
 *
 * <p>Conservation: {@code refundsTotal() + netPaymentToManufacturer + platformFeeCollected}
 * equals the value collected from retailers whenever every retailer paid at least the final
 * price, and {@code netPaymentToManufacturer + platformFeeCollected == totalValueForRewardCalc}
 * always holds exactly.
 *
 * @param finalPricePerUnit        Resolved unit price for the order's total units
 * @param netPaymentToManufacturer Gross value minus platform fee
 * @param platformFeeCollected     floor(gross * feeBps / 10000)
 * @param refunds                  Refunds in contribution order, only positive amounts
 * @param totalValueForRewardCalc  Gross value: total units times final price
 */
public record FulfillmentResult(
        long finalPricePerUnit,
        long netPaymentToManufacturer,
        long platformFeeCollected,
        List<RefundEntry> refunds,
        long totalValueForRewardCalc
) {

    public static FulfillmentResult empty() {
        return new FulfillmentResult(0L, 0L, 0L, List.of(), 0L);
    }

    public long refundsTotal() {
        return refunds.stream().mapToLong(RefundEntry::amount).sum();
    }
}

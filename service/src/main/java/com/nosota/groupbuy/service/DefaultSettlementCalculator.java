package com.nosota.groupbuy.service;

import com.nosota.groupbuy.dto.FulfillmentResult;
import com.nosota.groupbuy.dto.RefundEntry;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.PurchaseOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless settlement calculator.
 *
 * <p>Calculation:
 * <ol>
 *   <li>finalPrice resolved against the order's total units with the same rule as the
 *       running price, so it equals or improves on the last quoted price</li>
 *   <li>gross = totalUnits * finalPrice, fee = floor(gross * feeBps / 10000), net = gross - fee</li>
 *   <li>per contribution: refund = amountPaid - units * finalPrice when positive; retailers
 *       are never charged more after joining</li>
 * </ol>
 *
 * <p>Example: 100 units at final price 9, fee 100 bps
 * <pre>
 *   gross=900, fee=9, net=891
 *   retailer who paid 100 for 10 units → ideal 90 → refund 10
 * </pre>
 */
@Component
@Slf4j
public class DefaultSettlementCalculator implements SettlementCalculator {

    @Override
    public FulfillmentResult computeSettlement(PurchaseOrder order, List<Contribution> contributions,
                                               int platformFeeBps) {
        if (contributions.isEmpty()) {
            return FulfillmentResult.empty();
        }

        long totalUnits = order.getTotalUnitsCommitted();
        long finalPrice = PricingEngine.resolvePrice(order.getInitialPrice(), order.getDiscountTiers(), totalUnits);

        long grossValue = Math.multiplyExact(totalUnits, finalPrice);
        long platformFee = PricingEngine.basisPointsOf(grossValue, platformFeeBps);
        long netToManufacturer = grossValue - platformFee;

        List<RefundEntry> refunds = new ArrayList<>();
        for (Contribution contribution : contributions) {
            long idealPayment = Math.multiplyExact(contribution.getUnitsOrdered(), finalPrice);
            long difference = contribution.getAmountPaid() - idealPayment;
            if (difference > 0) {
                refunds.add(new RefundEntry(contribution.getRetailerId(), difference));
            }
        }

        log.debug("Settlement calculation for order {}: units={}, finalPrice={}, gross={}, fee={}, net={}, refunds={}",
                order.getId(), totalUnits, finalPrice, grossValue, platformFee, netToManufacturer, refunds.size());

        return new FulfillmentResult(finalPrice, netToManufacturer, platformFee, List.copyOf(refunds), grossValue);
    }
}

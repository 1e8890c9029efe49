package com.nosota.groupbuy.service;

import com.nosota.groupbuy.dto.FulfillmentResult;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.PurchaseOrder;

import java.util.List;

/**
 * Computes the settlement of a completed order.
 *
 * <p>Implementations are pure: they read their arguments and mutate nothing.
 */
public interface SettlementCalculator {

    /**
     * @param order          Order being settled
     * @param contributions  The order's contributions in join order
     * @param platformFeeBps Platform fee in basis points current at settlement time
     * @return Final price, fee split and refunds
     */
    FulfillmentResult computeSettlement(PurchaseOrder order, List<Contribution> contributions, int platformFeeBps);
}

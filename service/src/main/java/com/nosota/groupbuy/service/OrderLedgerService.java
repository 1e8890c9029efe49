package com.nosota.groupbuy.service;

import com.nosota.groupbuy.dto.NewOrder;
import com.nosota.groupbuy.dto.SettlementOutcome;
import com.nosota.groupbuy.error.LedgerException;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.PurchaseOrder;
import com.nosota.groupbuy.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Entry point for every state-mutating ledger operation.
 *
 * <p>Each call runs under the {@link ExecutionGuard}, which wraps the transactional
 * {@link OrderLifecycleService} or {@link RewardDistributor} call. Calls are therefore
 * serialized, commit before the next one starts, and a re-entrant call from inside an
 * operation fails with {@link com.nosota.groupbuy.error.StateConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLedgerService {

    private final ExecutionGuard executionGuard;
    private final OrderLifecycleService orderLifecycleService;
    private final LedgerParameters ledgerParameters;
    private final PurchaseOrderRepository purchaseOrderRepository;
    private final Clock clock;

    public PurchaseOrder createOrder(String callerId, NewOrder newOrder) {
        return executionGuard.execute("createOrder",
                () -> orderLifecycleService.createOrder(callerId, newOrder));
    }

    public Contribution joinOrder(String callerId, Long orderId, long units) {
        return executionGuard.execute("joinOrder",
                () -> orderLifecycleService.joinOrder(callerId, orderId, units));
    }

    public SettlementOutcome executeFulfillment(String callerId, Long orderId) {
        return executionGuard.execute("executeFulfillment",
                () -> orderLifecycleService.executeFulfillment(callerId, orderId));
    }

    public PurchaseOrder cancelOrder(String callerId, Long orderId) {
        return executionGuard.execute("cancelOrder",
                () -> orderLifecycleService.cancelOrder(callerId, orderId));
    }

    /**
     * Claims the caller's reward for a fulfilled order.
     *
     * @return Amount paid
     */
    public long claimReward(String callerId, Long orderId) {
        return executionGuard.execute("claimReward",
                () -> ledgerParameters.requireRewardDistributor().claim(orderId, callerId));
    }

    /**
     * Cancels every OPEN order whose deadline passed below threshold, acting as the
     * platform operator. Each order is cancelled in its own guarded transaction; a failure
     * is logged and does not stop the rest.
     *
     * @return Number of orders cancelled
     */
    public int cancelExpiredOrders() {
        List<Long> expiredOrderIds = purchaseOrderRepository.findExpiredUnderfundedOrderIds(LocalDateTime.now(clock));
        String operator = ledgerParameters.getOperatorAccount();

        int cancelledCount = 0;
        for (Long orderId : expiredOrderIds) {
            try {
                cancelOrder(operator, orderId);
                cancelledCount++;
            } catch (LedgerException e) {
                log.error("Failed to cancel expired order {} [{}]: {}", orderId, e.getKind(), e.getMessage(), e);
            }
        }

        log.info("Cancelled {} expired orders out of {} found", cancelledCount, expiredOrderIds.size());
        return cancelledCount;
    }
}

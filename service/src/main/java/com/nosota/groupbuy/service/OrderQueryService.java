package com.nosota.groupbuy.service;

import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.dto.FulfillmentResult;
import com.nosota.groupbuy.dto.SettlementOutcome;
import com.nosota.groupbuy.error.StateConflictException;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.NotificationLogEntry;
import com.nosota.groupbuy.model.PurchaseOrder;
import com.nosota.groupbuy.model.RewardRecord;
import com.nosota.groupbuy.repository.ContributionRepository;
import com.nosota.groupbuy.repository.NotificationLogRepository;
import com.nosota.groupbuy.repository.PurchaseOrderRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Read-only access to orders, contributions, rewards and notifications.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderQueryService {

    private final PurchaseOrderRepository purchaseOrderRepository;
    private final ContributionRepository contributionRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final RewardDistributor rewardDistributor;
    private final LedgerParameters ledgerParameters;

    public PurchaseOrder getOrder(@NotNull Long orderId) {
        return purchaseOrderRepository.findById(orderId)
                .orElseThrow(() -> new EntityNotFoundException("Order not found: " + orderId));
    }

    /**
     * Gets the contributions of an order in join order.
     */
    public List<Contribution> getContributions(@NotNull Long orderId) {
        getOrder(orderId);
        return contributionRepository.findByOrderIdOrderByIdAsc(orderId);
    }

    /**
     * Lists orders newest first.
     *
     * @param status   Optional status filter, null for all
     * @param pageable Pagination
     */
    public Page<PurchaseOrder> listOrders(OrderStatus status, Pageable pageable) {
        if (status == null) {
            return purchaseOrderRepository.findAllByOrderByIdDesc(pageable);
        }
        return switch (status) {
            case OPEN -> purchaseOrderRepository.findByActiveAndFulfilledOrderByIdDesc(true, false, pageable);
            case FULFILLED -> purchaseOrderRepository.findByActiveAndFulfilledOrderByIdDesc(false, true, pageable);
            case CANCELLED -> purchaseOrderRepository.findByActiveAndFulfilledOrderByIdDesc(false, false, pageable);
        };
    }

    public List<NotificationLogEntry> getNotifications(@NotNull Long orderId) {
        getOrder(orderId);
        return notificationLogRepository.findByOrderIdOrderByIdAsc(orderId);
    }

    public List<RewardRecord> getRewards(@NotNull Long orderId) {
        getOrder(orderId);
        return rewardDistributor.listRewards(orderId);
    }

    /**
     * Gets a retailer's reward for an order.
     *
     * @throws EntityNotFoundException if no reward was recorded for the retailer
     */
    public RewardRecord getReward(@NotNull Long orderId, @NotNull String retailerId) {
        return rewardDistributor.findReward(orderId, retailerId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("No reward for participant %s on order %d", retailerId, orderId)));
    }

    /**
     * Computes what fulfilling an OPEN order would pay out right now, with the current
     * global rates. Nothing is written.
     *
     * @throws StateConflictException if the order is not OPEN
     */
    public SettlementOutcome previewSettlement(@NotNull Long orderId) {
        PurchaseOrder order = getOrder(orderId);
        if (order.getStatus() != OrderStatus.OPEN) {
            throw new StateConflictException(
                    String.format("Order %d is %s, preview requires OPEN", orderId, order.getStatus()));
        }

        int platformFeeBps = ledgerParameters.getPlatformFeeBps();
        int rewardBps = ledgerParameters.getRewardBps();

        FulfillmentResult result = ledgerParameters.requireSettlementCalculator().computeSettlement(
                order, contributionRepository.findByOrderIdOrderByIdAsc(orderId), platformFeeBps);
        long rewardPool = PricingEngine.basisPointsOf(result.totalValueForRewardCalc(), rewardBps);

        log.debug("Settlement preview for order {}: finalPrice={}, net={}, fee={}, rewardPool={}",
                orderId, result.finalPricePerUnit(), result.netPaymentToManufacturer(),
                result.platformFeeCollected(), rewardPool);

        return new SettlementOutcome(orderId, result, rewardPool, platformFeeBps, rewardBps, OrderStatus.OPEN);
    }
}

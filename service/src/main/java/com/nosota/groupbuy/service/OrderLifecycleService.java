package com.nosota.groupbuy.service;

import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.dto.FulfillmentResult;
import com.nosota.groupbuy.dto.NewOrder;
import com.nosota.groupbuy.dto.RefundEntry;
import com.nosota.groupbuy.dto.SettlementOutcome;
import com.nosota.groupbuy.error.DeadlineViolationException;
import com.nosota.groupbuy.error.InsufficientFundsException;
import com.nosota.groupbuy.error.InvalidParametersException;
import com.nosota.groupbuy.error.StateConflictException;
import com.nosota.groupbuy.error.UnauthorizedException;
import com.nosota.groupbuy.event.OrderCancelled;
import com.nosota.groupbuy.event.OrderCreated;
import com.nosota.groupbuy.event.OrderProcessed;
import com.nosota.groupbuy.event.OrderReadyForProcessing;
import com.nosota.groupbuy.event.PriceUpdated;
import com.nosota.groupbuy.event.RetailerJoined;
import com.nosota.groupbuy.event.StakeReturned;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.DiscountTier;
import com.nosota.groupbuy.model.PurchaseOrder;
import com.nosota.groupbuy.repository.ContributionRepository;
import com.nosota.groupbuy.repository.PurchaseOrderRepository;
import com.nosota.groupbuy.transfer.ValueTransferPort;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Transactional order lifecycle: creation, joins, fulfillment and cancellation.
 *
 * <p>Every method runs in one transaction together with the value transfers it makes
 * (the sandbox transfer ports join it), so a failed step leaves no trace. Callers go
 * through {@link OrderLedgerService}, which serializes them with the {@link ExecutionGuard}.
 *
 * <p>Value custody:
 * <ul>
 *   <li>PAYMENT: retailer prepayments are held in the ledger custody account until the
 *       order is fulfilled (split into refunds, manufacturer payment and platform fee) or
 *       cancelled (refunded in full)</li>
 *   <li>REWARD: manufacturer stakes are held in the ledger custody account and returned on
 *       either outcome</li>
 *   <li>REWARD: reward pools are paid to the distributor from the reward reserve account,
 *       which holds no stakes</li>
 * </ul>
 *
 * <p>Closing flags are flushed before any outgoing transfer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleService {

    private final PurchaseOrderRepository purchaseOrderRepository;
    private final ContributionRepository contributionRepository;
    private final OrderStatusStateMachine stateMachine;
    private final LedgerParameters ledgerParameters;
    @Qualifier("ledgerPaymentPort")
    private final ValueTransferPort paymentPort;
    @Qualifier("ledgerRewardPort")
    private final ValueTransferPort rewardPort;
    @Qualifier("rewardReservePort")
    private final ValueTransferPort rewardReservePort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Creates an OPEN order and collects the manufacturer's stake.
     *
     * @param callerId Manufacturer creating the order
     * @param newOrder Order terms
     * @return Created order
     * @throws InvalidParametersException if the terms are invalid
     * @throws InsufficientFundsException if the stake cannot be collected
     */
    @Transactional
    public PurchaseOrder createOrder(String callerId, NewOrder newOrder) {
        validateNewOrder(newOrder);

        List<DiscountTier> tiers = newOrder.discountTiers() == null
                ? List.of()
                : newOrder.discountTiers();

        LocalDateTime now = LocalDateTime.now(clock);

        PurchaseOrder order = new PurchaseOrder();
        order.setManufacturerId(callerId);
        order.setProductId(newOrder.productId());
        order.setMinUnits(newOrder.minUnits());
        order.setInitialPrice(newOrder.initialPrice());
        order.setCurrentPrice(newOrder.initialPrice());
        order.setTotalUnitsCommitted(0L);
        order.setTotalValueCollected(0L);
        order.setStakeAmount(newOrder.stakeAmount());
        order.setDiscountTiers(new ArrayList<>(tiers));
        order.setCreatedAt(now);
        order.setDeadline(now.plusSeconds(newOrder.durationSeconds()));
        order.setActive(true);
        order.setFulfilled(false);
        order = purchaseOrderRepository.save(order);

        if (newOrder.stakeAmount() > 0) {
            requireTransfer(rewardPort.transferFrom(callerId, rewardPort.custodyAccount(), newOrder.stakeAmount()),
                    String.format("Cannot collect stake %d from %s for order %d",
                            newOrder.stakeAmount(), callerId, order.getId()));
        }

        eventPublisher.publishEvent(new OrderCreated(
                order.getId(), callerId, order.getProductId(), order.getMinUnits(),
                order.getInitialPrice(), order.getStakeAmount(), order.getDeadline()));

        log.info("Order created: id={}, manufacturer={}, product={}, minUnits={}, initialPrice={}, stake={}, deadline={}",
                order.getId(), callerId, order.getProductId(), order.getMinUnits(),
                order.getInitialPrice(), order.getStakeAmount(), order.getDeadline());

        return order;
    }

    /**
     * Joins an OPEN order with a single contribution, prepaying at the current price.
     *
     * @return The recorded contribution
     * @throws StateConflictException     if the order is not OPEN or the caller already joined
     * @throws DeadlineViolationException if the deadline has passed
     * @throws InvalidParametersException if units is not positive
     * @throws InsufficientFundsException if the prepayment cannot be collected
     */
    @Transactional
    public Contribution joinOrder(String callerId, Long orderId, long units) {
        PurchaseOrder order = getOrder(orderId);

        if (order.getStatus() != OrderStatus.OPEN) {
            throw new StateConflictException(
                    String.format("Order %d is %s, joining requires OPEN", orderId, order.getStatus()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (order.isExpired(now)) {
            throw new DeadlineViolationException(
                    String.format("Order %d deadline %s has passed", orderId, order.getDeadline()));
        }
        if (units <= 0) {
            throw new InvalidParametersException("Units must be positive, got " + units);
        }
        if (contributionRepository.existsByOrderIdAndRetailerId(orderId, callerId)) {
            throw new StateConflictException(
                    String.format("Participant %s already joined order %d", callerId, orderId));
        }

        long amount = Math.multiplyExact(units, order.getCurrentPrice());
        requireTransfer(paymentPort.transferFrom(callerId, paymentPort.custodyAccount(), amount),
                String.format("Cannot collect %d from %s for order %d", amount, callerId, orderId));

        Contribution contribution = new Contribution();
        contribution.setOrderId(orderId);
        contribution.setRetailerId(callerId);
        contribution.setUnitsOrdered(units);
        contribution.setAmountPaid(amount);
        contribution.setJoinedAt(now);
        contribution = contributionRepository.save(contribution);

        long previousPrice = order.getCurrentPrice();
        order.setTotalUnitsCommitted(Math.addExact(order.getTotalUnitsCommitted(), units));
        order.setTotalValueCollected(Math.addExact(order.getTotalValueCollected(), amount));

        int discountBps = PricingEngine.resolveDiscount(order.getDiscountTiers(), order.getTotalUnitsCommitted());
        long newPrice = PricingEngine.applyDiscount(order.getInitialPrice(), discountBps);
        order.setCurrentPrice(newPrice);
        purchaseOrderRepository.save(order);

        eventPublisher.publishEvent(new RetailerJoined(
                orderId, callerId, units, amount, order.getTotalUnitsCommitted()));

        if (newPrice != previousPrice) {
            eventPublisher.publishEvent(new PriceUpdated(orderId, previousPrice, newPrice, discountBps));
            log.info("Order {} price updated: {} → {} ({} bps)", orderId, previousPrice, newPrice, discountBps);
        }

        if (order.isThresholdReached()) {
            eventPublisher.publishEvent(new OrderReadyForProcessing(
                    orderId, order.getTotalUnitsCommitted(), order.getMinUnits()));
        }

        log.info("Retailer joined: orderId={}, retailer={}, units={}, paid={}, totalUnits={}/{}",
                orderId, callerId, units, amount, order.getTotalUnitsCommitted(), order.getMinUnits());

        return contribution;
    }

    /**
     * Settles an OPEN order that reached its threshold. Anyone may trigger it.
     *
     * <p>Effects, in order:
     * <ol>
     *   <li>Order flagged FULFILLED</li>
     *   <li>Overpayments refunded to retailers</li>
     *   <li>Net payment to the manufacturer</li>
     *   <li>Platform fee to the fee recipient</li>
     *   <li>Stake returned to the manufacturer</li>
     *   <li>Reward pool funded and recorded, when positive</li>
     * </ol>
     *
     * @throws StateConflictException        if the order is not OPEN or below threshold
     * @throws com.nosota.groupbuy.error.ServiceNotConfiguredException if services are detached
     * @throws InsufficientFundsException    if a transfer fails
     */
    @Transactional
    public SettlementOutcome executeFulfillment(String callerId, Long orderId) {
        PurchaseOrder order = getOrder(orderId);

        stateMachine.validateTransition(orderId, order.getStatus(), OrderStatus.FULFILLED);
        if (!order.isThresholdReached()) {
            throw new StateConflictException(String.format(
                    "Order %d has %d of %d units, threshold not reached",
                    orderId, order.getTotalUnitsCommitted(), order.getMinUnits()));
        }

        SettlementCalculator calculator = ledgerParameters.requireSettlementCalculator();
        RewardDistributor distributor = ledgerParameters.requireRewardDistributor();
        int platformFeeBps = ledgerParameters.getPlatformFeeBps();
        int rewardBps = ledgerParameters.getRewardBps();
        String feeRecipient = ledgerParameters.getFeeRecipient();

        order.setActive(false);
        order.setFulfilled(true);
        purchaseOrderRepository.saveAndFlush(order);

        List<Contribution> contributions = contributionRepository.findByOrderIdOrderByIdAsc(orderId);
        FulfillmentResult result = calculator.computeSettlement(order, contributions, platformFeeBps);

        for (RefundEntry refund : result.refunds()) {
            payFromCustody(paymentPort, refund.retailerId(), refund.amount(), orderId, "refund");
        }
        payFromCustody(paymentPort, order.getManufacturerId(), result.netPaymentToManufacturer(), orderId, "net payment");
        payFromCustody(paymentPort, feeRecipient, result.platformFeeCollected(), orderId, "platform fee");

        returnStake(order);

        long rewardPool = PricingEngine.basisPointsOf(result.totalValueForRewardCalc(), rewardBps);
        if (rewardPool > 0) {
            payFromCustody(rewardReservePort, distributor.rewardAccount(), rewardPool, orderId, "reward pool");
            distributor.recordRewards(orderId, rewardPool, order.getTotalUnitsCommitted(), contributions);
        }

        eventPublisher.publishEvent(new OrderProcessed(
                orderId, order.getManufacturerId(), result.finalPricePerUnit(),
                result.netPaymentToManufacturer(), result.platformFeeCollected(),
                result.refundsTotal(), rewardPool));

        log.info("Order fulfilled: id={}, by={}, finalPrice={}, gross={}, net={}, fee={}, refunds={}, rewardPool={}",
                orderId, callerId, result.finalPricePerUnit(), result.totalValueForRewardCalc(),
                result.netPaymentToManufacturer(), result.platformFeeCollected(), result.refundsTotal(), rewardPool);

        return new SettlementOutcome(orderId, result, rewardPool, platformFeeBps, rewardBps, OrderStatus.FULFILLED);
    }

    /**
     * Cancels an OPEN order whose deadline passed below threshold, refunding every
     * contribution in full and returning the stake.
     *
     * @throws UnauthorizedException      if the caller is neither the manufacturer nor an administrator
     * @throws StateConflictException     if the order is not OPEN
     * @throws DeadlineViolationException if the deadline has not passed or the threshold was reached
     */
    @Transactional
    public PurchaseOrder cancelOrder(String callerId, Long orderId) {
        PurchaseOrder order = getOrder(orderId);

        if (!order.getManufacturerId().equals(callerId) && !ledgerParameters.isAdministrator(callerId)) {
            throw new UnauthorizedException(
                    String.format("Participant %s may not cancel order %d", callerId, orderId));
        }

        stateMachine.validateTransition(orderId, order.getStatus(), OrderStatus.CANCELLED);

        LocalDateTime now = LocalDateTime.now(clock);
        if (!order.isExpired(now) || order.isThresholdReached()) {
            throw new DeadlineViolationException(String.format(
                    "Order %d can only be cancelled after its deadline %s without reaching threshold (%d/%d units)",
                    orderId, order.getDeadline(), order.getTotalUnitsCommitted(), order.getMinUnits()));
        }

        order.setActive(false);
        order.setFulfilled(false);
        purchaseOrderRepository.saveAndFlush(order);

        long refundedTotal = 0L;
        for (Contribution contribution : contributionRepository.findByOrderIdOrderByIdAsc(orderId)) {
            payFromCustody(paymentPort, contribution.getRetailerId(), contribution.getAmountPaid(), orderId, "refund");
            refundedTotal += contribution.getAmountPaid();
        }

        eventPublisher.publishEvent(new OrderCancelled(orderId, callerId, refundedTotal));
        returnStake(order);

        log.info("Order cancelled: id={}, by={}, refunded={}, stakeReturned={}",
                orderId, callerId, refundedTotal, order.getStakeAmount());

        return order;
    }

    private void returnStake(PurchaseOrder order) {
        if (order.getStakeAmount() > 0) {
            payFromCustody(rewardPort, order.getManufacturerId(), order.getStakeAmount(), order.getId(), "stake return");
            eventPublisher.publishEvent(new StakeReturned(order.getId(), order.getManufacturerId(), order.getStakeAmount()));
        }
    }

    private void payFromCustody(ValueTransferPort port, String to, long amount, Long orderId, String purpose) {
        requireTransfer(port.transfer(to, amount), String.format(
                "Cannot pay %s of %d %s to %s for order %d", purpose, amount, port.asset(), to, orderId));
    }

    private static void requireTransfer(boolean transferred, String message) {
        if (!transferred) {
            throw new InsufficientFundsException(message);
        }
    }

    private PurchaseOrder getOrder(Long orderId) {
        return purchaseOrderRepository.findById(orderId)
                .orElseThrow(() -> new EntityNotFoundException("Order not found: " + orderId));
    }

    private static void validateNewOrder(NewOrder newOrder) {
        if (newOrder.productId() == null || newOrder.productId().isBlank()) {
            throw new InvalidParametersException("Product ID must not be blank");
        }
        if (newOrder.minUnits() <= 0) {
            throw new InvalidParametersException("Minimum units must be positive, got " + newOrder.minUnits());
        }
        if (newOrder.initialPrice() <= 0) {
            throw new InvalidParametersException("Initial price must be positive, got " + newOrder.initialPrice());
        }
        if (newOrder.durationSeconds() <= 0) {
            throw new InvalidParametersException("Duration must be positive, got " + newOrder.durationSeconds());
        }
        if (newOrder.stakeAmount() < 0) {
            throw new InvalidParametersException("Stake must not be negative, got " + newOrder.stakeAmount());
        }
        if (newOrder.discountTiers() != null) {
            for (DiscountTier tier : newOrder.discountTiers()) {
                if (tier.getUnitsThreshold() <= 0) {
                    throw new InvalidParametersException(
                            "Discount tier threshold must be positive, got " + tier.getUnitsThreshold());
                }
                if (tier.getDiscountBps() < 0 || tier.getDiscountBps() > PricingEngine.BASIS_POINTS) {
                    throw new InvalidParametersException(
                            "Discount tier bps must be between 0 and 10000, got " + tier.getDiscountBps());
                }
            }
        }
    }
}

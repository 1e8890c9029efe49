package com.nosota.groupbuy.tests;

import com.nosota.groupbuy.TestBase;
import com.nosota.groupbuy.api.model.NotificationType;
import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.dto.SettlementOutcome;
import com.nosota.groupbuy.error.DeadlineViolationException;
import com.nosota.groupbuy.error.StateConflictException;
import com.nosota.groupbuy.error.UnauthorizedException;
import com.nosota.groupbuy.model.NotificationLogEntry;
import com.nosota.groupbuy.model.PurchaseOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for cancellation of orders that missed their deadline.
 */
@DisplayName("3. Cancellation Tests")
public class CancellationTest extends TestBase {

    @Test
    @DisplayName("CAN-001: Manufacturer cancels an expired order, every retailer is refunded in full")
    void testCancelExpiredOrder() {
        String manufacturer = newManufacturer(300L);
        String retailerA = newRetailer(1_000L);
        String retailerB = newRetailer(1_000L);
        long custodyBefore = paymentBalance(custodyAccount);

        PurchaseOrder order = createReferenceOrder(manufacturer, 300L);
        orderLedgerService.joinOrder(retailerA, order.getId(), 30L);
        orderLedgerService.joinOrder(retailerB, order.getId(), 20L);

        clock.advance(Duration.ofSeconds(3601));
        PurchaseOrder cancelled = orderLedgerService.cancelOrder(manufacturer, order.getId());

        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(cancelled.isActive()).isFalse();
        assertThat(cancelled.isFulfilled()).isFalse();

        assertThat(paymentBalance(retailerA)).isEqualTo(1_000L);
        assertThat(paymentBalance(retailerB)).isEqualTo(1_000L);
        assertThat(paymentBalance(custodyAccount)).isEqualTo(custodyBefore);
        assertThat(rewardBalance(manufacturer)).isEqualTo(300L);

        assertThat(orderQueryService.getNotifications(order.getId()))
                .extracting(NotificationLogEntry::getType)
                .endsWith(NotificationType.ORDER_CANCELLED, NotificationType.STAKE_RETURNED);
    }

    @Test
    @DisplayName("CAN-002: Cancelling before the deadline is a deadline violation")
    void testCancelBeforeDeadline() {
        String manufacturer = newManufacturer(0L);
        PurchaseOrder order = createReferenceOrder(manufacturer, 0L);

        assertThatThrownBy(() -> orderLedgerService.cancelOrder(manufacturer, order.getId()))
                .isInstanceOf(DeadlineViolationException.class);

        clock.advance(Duration.ofSeconds(3600));
        assertThatThrownBy(() -> orderLedgerService.cancelOrder(manufacturer, order.getId()))
                .isInstanceOf(DeadlineViolationException.class);

        assertThat(orderQueryService.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.OPEN);
    }

    @Test
    @DisplayName("CAN-003: An order that met its threshold can never be cancelled")
    void testCancellationExclusivity() {
        String manufacturer = newManufacturer(0L);
        PurchaseOrder order = createReferenceOrder(manufacturer, 0L);
        orderLedgerService.joinOrder(newRetailer(10_000L), order.getId(), 100L);

        clock.advance(Duration.ofDays(30));

        assertThatThrownBy(() -> orderLedgerService.cancelOrder(manufacturer, order.getId()))
                .isInstanceOf(DeadlineViolationException.class);
        assertThatThrownBy(() -> orderLedgerService.cancelOrder(ADMIN, order.getId()))
                .isInstanceOf(DeadlineViolationException.class);

        // Still settleable after the deadline
        assertThat(orderLedgerService.executeFulfillment(manufacturer, order.getId()).status())
                .isEqualTo(OrderStatus.FULFILLED);
    }

    @Test
    @DisplayName("CAN-004: Only the manufacturer or an administrator may cancel")
    void testCancelUnauthorized() {
        String manufacturer = newManufacturer(0L);
        String retailer = newRetailer(1_000L);
        PurchaseOrder order = createReferenceOrder(manufacturer, 0L);
        orderLedgerService.joinOrder(retailer, order.getId(), 10L);
        clock.advance(Duration.ofSeconds(3601));

        assertThatThrownBy(() -> orderLedgerService.cancelOrder(retailer, order.getId()))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(orderQueryService.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.OPEN);

        orderLedgerService.cancelOrder(ADMIN, order.getId());
        assertThat(orderQueryService.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(paymentBalance(retailer)).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("CAN-005: A closed order cannot be cancelled again")
    void testCancelTwice() {
        String manufacturer = newManufacturer(0L);
        PurchaseOrder order = createReferenceOrder(manufacturer, 0L);
        clock.advance(Duration.ofSeconds(3601));

        orderLedgerService.cancelOrder(manufacturer, order.getId());

        assertThatThrownBy(() -> orderLedgerService.cancelOrder(manufacturer, order.getId()))
                .isInstanceOf(StateConflictException.class);
        assertThat(notificationLogRepository.countByOrderIdAndType(order.getId(), NotificationType.ORDER_CANCELLED))
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("CAN-006: Expired underfunded orders are cancelled by the platform operator")
    void testCancelExpiredOrdersJob() {
        String manufacturer = newManufacturer(50L);
        String retailer = newRetailer(1_000L);
        PurchaseOrder expiring = createReferenceOrder(manufacturer, 50L);
        orderLedgerService.joinOrder(retailer, expiring.getId(), 10L);

        PurchaseOrder funded = createOrder(newManufacturer(0L), 1L, 10L, List.of(), 0L, 3600L);
        orderLedgerService.joinOrder(newRetailer(100L), funded.getId(), 1L);

        PurchaseOrder longRunning = createOrder(newManufacturer(0L), 1L, 10L, List.of(), 0L, 86_400L);

        clock.advance(Duration.ofSeconds(3601));
        int cancelled = orderLedgerService.cancelExpiredOrders();

        assertThat(cancelled).isGreaterThanOrEqualTo(1);
        assertThat(orderQueryService.getOrder(expiring.getId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(orderQueryService.getOrder(funded.getId()).getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(orderQueryService.getOrder(longRunning.getId()).getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(paymentBalance(retailer)).isEqualTo(1_000L);
        assertThat(rewardBalance(manufacturer)).isEqualTo(50L);
    }

    @Test
    @DisplayName("CAN-007: Settling another order leaves an open order's stake available for cancellation")
    void testCancelAfterOtherSettlement() {
        String manufacturer = newManufacturer(100L);
        String retailer = newRetailer(100L);
        PurchaseOrder staked = createReferenceOrder(manufacturer, 100L);
        orderLedgerService.joinOrder(retailer, staked.getId(), 10L);

        PurchaseOrder settled = createReferenceOrder(newManufacturer(0L), 0L);
        orderLedgerService.joinOrder(newRetailer(10_000L), settled.getId(), 100L);
        long reserveBefore = rewardBalance(rewardReserveAccount);
        SettlementOutcome outcome = orderLedgerService.executeFulfillment(newParticipant("keeper"), settled.getId());

        assertThat(outcome.rewardPool()).isPositive();
        assertThat(rewardBalance(rewardReserveAccount)).isEqualTo(reserveBefore - outcome.rewardPool());
        assertThat(rewardBalance(custodyAccount)).isEqualTo(openOrderStakes());

        clock.advance(Duration.ofSeconds(3601));
        PurchaseOrder cancelled = orderLedgerService.cancelOrder(manufacturer, staked.getId());

        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(rewardBalance(manufacturer)).isEqualTo(100L);
        assertThat(paymentBalance(retailer)).isEqualTo(100L);
        assertThat(rewardBalance(custodyAccount)).isEqualTo(openOrderStakes());
    }
}

package com.nosota.groupbuy.service;

import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.error.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating OrderStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *          OPEN
 *           |
 *     +-----+-----+
 *     |           |
 * FULFILLED   CANCELLED
 * </pre>
 *
 * <p>FULFILLED and CANCELLED are terminal.
 */
@Component
public class OrderStatusStateMachine {

    private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED_TRANSITIONS = Map.of(
            OrderStatus.OPEN, EnumSet.of(OrderStatus.FULFILLED, OrderStatus.CANCELLED)
    );

    public boolean isTransitionAllowed(OrderStatus fromStatus, OrderStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<OrderStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a status transition.
     *
     * @param orderId    Order being transitioned, for the error message
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws StateConflictException if the transition is not allowed
     */
    public void validateTransition(Long orderId, OrderStatus fromStatus, OrderStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new StateConflictException(
                    String.format("Order %d cannot move %s → %s, allowed from %s: %s",
                            orderId, fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    public boolean isFinalState(OrderStatus status) {
        return status == OrderStatus.FULFILLED || status == OrderStatus.CANCELLED;
    }
}

package com.nosota.groupbuy.api.model;

/**
 * Lifecycle status of a group-buy order.
 *
 * <pre>
 *          OPEN
 *           |
 *     +-----+------+
 *     |            |
 * FULFILLED    CANCELLED
 * </pre>
 */
public enum OrderStatus {
    /**
     * OPEN: retailers may join until the deadline.
     * The order can be fulfilled once the minimum units threshold is reached.
     */
    OPEN,

    /**
     * FULFILLED: settlement has been executed.
     * This is a final state.
     */
    FULFILLED,

    /**
     * CANCELLED: the deadline passed without reaching the threshold and all
     * contributions were refunded in full.
     * This is a final state.
     */
    CANCELLED
}

package com.nosota.groupbuy.error;

/**
 * Failure categories of ledger operations.
 * Every failure rejects the whole operation; nothing is retried automatically.
 */
public enum ErrorKind {
    /**
     * Zero or negative units or price, malformed discount tiers, arithmetic overflow.
     */
    INVALID_PARAMETERS,

    /**
     * Caller is not the required principal.
     */
    UNAUTHORIZED,

    /**
     * Action attempted against an order or reward not in the required state
     * (joining a closed order, double join, double claim, re-entrant call).
     */
    STATE_CONFLICT,

    /**
     * Join after the deadline, or cancel before the deadline or after the threshold was met.
     */
    DEADLINE_VIOLATION,

    /**
     * A value transfer failed or a balance check did not cover the required amount.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Fulfillment attempted while the settlement calculator or reward distributor is detached.
     */
    SERVICE_NOT_CONFIGURED,

    /**
     * Claim by a participant with no (or a zero) reward for the order.
     */
    NO_REWARD
}

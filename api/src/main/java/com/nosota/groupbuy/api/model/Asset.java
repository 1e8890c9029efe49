package com.nosota.groupbuy.api.model;

/**
 * Value assets moved by the ledger. The two are never intermixed.
 */
public enum Asset {
    /**
     * Order payments, refunds, manufacturer payouts and platform fees.
     */
    PAYMENT,

    /**
     * Manufacturer stakes, reward pool funding and reward claims.
     */
    REWARD
}

package com.nosota.groupbuy.api.response;

/**
 * Current global settlement parameters.
 *
 * @param platformFeeBps   Platform fee in basis points
 * @param rewardBps        Reward pool share in basis points
 * @param feeRecipient     Account receiving platform fees
 * @param servicesAttached Whether the settlement calculator and reward distributor are attached
 */
public record ParametersResponse(
        Integer platformFeeBps,
        Integer rewardBps,
        String feeRecipient,
        boolean servicesAttached
) {
}

package com.nosota.groupbuy.api.response;

/**
 * Response for a reward claim.
 */
public record ClaimResponse(
        Long orderId,
        String retailerId,
        Long amount
) {}

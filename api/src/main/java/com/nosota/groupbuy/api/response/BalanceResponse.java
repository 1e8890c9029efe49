package com.nosota.groupbuy.api.response;

import com.nosota.groupbuy.api.model.Asset;

/**
 * Balance of a token account.
 */
public record BalanceResponse(
        Asset asset,
        String accountId,
        Long balance
) {}

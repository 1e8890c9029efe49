package com.nosota.groupbuy.transfer;

import com.nosota.groupbuy.api.model.Asset;
import lombok.RequiredArgsConstructor;

/**
 * {@link ValueTransferPort} backed by the in-process {@link TokenAccountService}.
 *
 * <p>Transfers join the caller's transaction, so a ledger operation that fails after
 * moving value leaves every balance as it was.
 */
@RequiredArgsConstructor
public class AccountTransferPort implements ValueTransferPort {

    private final Asset asset;
    private final String custodyAccount;
    private final TokenAccountService tokenAccountService;

    @Override
    public Asset asset() {
        return asset;
    }

    @Override
    public String custodyAccount() {
        return custodyAccount;
    }

    @Override
    public boolean transferFrom(String from, String to, long amount) {
        return tokenAccountService.move(asset, from, to, amount);
    }

    @Override
    public boolean transfer(String to, long amount) {
        return tokenAccountService.move(asset, custodyAccount, to, amount);
    }

    @Override
    public long balanceOf(String accountId) {
        return tokenAccountService.balanceOf(asset, accountId);
    }

    @Override
    public String toString() {
        return "AccountTransferPort[" + asset + ", custody=" + custodyAccount + "]";
    }
}

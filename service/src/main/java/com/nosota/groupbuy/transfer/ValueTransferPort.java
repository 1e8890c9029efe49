package com.nosota.groupbuy.transfer;

import com.nosota.groupbuy.api.model.Asset;

/**
 * Capability to move one fungible asset between participant accounts.
 *
 * <p>The ledger treats value transfer as a trusted external service: each call is atomic
 * and either moves the full amount or returns {@code false} without moving anything.
 * Amounts are non-negative integers in the asset's smallest unit.
 *
 * <p>A port is bound to a custody account: {@link #transfer(String, long)} spends from it.
 * Two assets are used ({@link Asset#PAYMENT} and {@link Asset#REWARD}) and a port never
 * moves more than one of them.
 */
public interface ValueTransferPort {

    Asset asset();

    /**
     * Account that {@link #transfer(String, long)} pays from.
     */
    String custodyAccount();

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @return true if the transfer happened, false if {@code from} cannot cover the amount
     */
    boolean transferFrom(String from, String to, long amount);

    /**
     * Moves {@code amount} from the custody account to {@code to}.
     *
     * @return true if the transfer happened, false if the custody account cannot cover the amount
     */
    boolean transfer(String to, long amount);

    long balanceOf(String accountId);
}

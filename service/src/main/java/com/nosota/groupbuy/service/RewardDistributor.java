package com.nosota.groupbuy.service;

import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.RewardRecord;

import java.util.List;
import java.util.Optional;

/**
 * Records the proportional reward pool of a settled order and pays out individual claims.
 */
public interface RewardDistributor {

    /**
     * Reward-asset account holding funded, unclaimed rewards.
     */
    String rewardAccount();

    /**
     * Splits {@code totalRewardPool} among the contributions in proportion to their units.
     * Called once per order, at settlement, after the pool has been transferred to
     * {@link #rewardAccount()}.
     *
     * @param orderId           Settled order
     * @param totalRewardPool   Pool to distribute (must be positive)
     * @param totalUnitsInOrder Units committed to the order (must be positive)
     * @param contributions     The order's contributions
     */
    void recordRewards(Long orderId, long totalRewardPool, long totalUnitsInOrder, List<Contribution> contributions);

    /**
     * Pays the caller's recorded reward for an order.
     *
     * @return Amount paid
     */
    long claim(Long orderId, String callerId);

    Optional<RewardRecord> findReward(Long orderId, String retailerId);

    List<RewardRecord> listRewards(Long orderId);
}

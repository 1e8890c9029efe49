package com.nosota.groupbuy.service;

import com.nosota.groupbuy.error.InsufficientFundsException;
import com.nosota.groupbuy.error.InvalidParametersException;
import com.nosota.groupbuy.error.NoRewardException;
import com.nosota.groupbuy.error.StateConflictException;
import com.nosota.groupbuy.event.RewardClaimed;
import com.nosota.groupbuy.event.RewardsRecorded;
import com.nosota.groupbuy.model.Contribution;
import com.nosota.groupbuy.model.RewardRecord;
import com.nosota.groupbuy.repository.RewardRecordRepository;
import com.nosota.groupbuy.transfer.ValueTransferPort;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reward distribution for settled orders.
 *
 * <p>Distribution rule, per contribution with units &gt; 0:
 * <pre>
 *   reward = floor(totalRewardPool * unitsOrdered / totalUnitsInOrder)
 * </pre>
 * Zero rewards produce no record. The rounding dust
 * {@code totalRewardPool - sum(rewards)} stays in the reward account unassigned and is
 * smaller than the number of contributions.
 *
 * <p>The reward balance is held in {@link #rewardAccount()} and only changes through
 * pool funding at settlement and claims.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardDistributorService implements RewardDistributor {

    private final RewardRecordRepository rewardRecordRepository;
    @Qualifier("distributorRewardPort")
    private final ValueTransferPort rewardPort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public String rewardAccount() {
        return rewardPort.custodyAccount();
    }

    /**
     * Records rewards for a settled order.
     *
     * @throws InvalidParametersException if the pool or the total units is not positive
     * @throws StateConflictException     if rewards were already recorded for the order
     * @throws InsufficientFundsException if the reward account holds less than the pool
     */
    @Override
    @Transactional
    public void recordRewards(Long orderId, long totalRewardPool, long totalUnitsInOrder,
                              List<Contribution> contributions) {
        if (totalRewardPool <= 0 || totalUnitsInOrder <= 0) {
            throw new InvalidParametersException(String.format(
                    "Reward pool and total units must be positive for order %d: pool=%d, units=%d",
                    orderId, totalRewardPool, totalUnitsInOrder));
        }
        if (rewardRecordRepository.existsByOrderId(orderId)) {
            throw new StateConflictException("Rewards already recorded for order " + orderId);
        }

        long held = rewardPort.balanceOf(rewardAccount());
        if (held < totalRewardPool) {
            throw new InsufficientFundsException(String.format(
                    "Reward account %s holds %d, pool for order %d requires %d",
                    rewardAccount(), held, orderId, totalRewardPool));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        long distributed = 0L;
        int recorded = 0;

        for (Contribution contribution : contributions) {
            if (contribution.getUnitsOrdered() <= 0) {
                continue;
            }
            long reward = Math.multiplyExact(totalRewardPool, contribution.getUnitsOrdered()) / totalUnitsInOrder;
            if (reward <= 0) {
                continue;
            }

            RewardRecord record = new RewardRecord();
            record.setOrderId(orderId);
            record.setRetailerId(contribution.getRetailerId());
            record.setAmount(reward);
            record.setClaimed(false);
            record.setRecordedAt(now);
            rewardRecordRepository.save(record);

            distributed += reward;
            recorded++;
            eventPublisher.publishEvent(new RewardsRecorded(orderId, contribution.getRetailerId(), reward));
        }

        log.info("Recorded rewards for order {}: pool={}, distributed={}, dust={}, records={}",
                orderId, totalRewardPool, distributed, totalRewardPool - distributed, recorded);
    }

    /**
     * Claims the caller's reward.
     *
     * <p>The record is marked claimed and flushed before the transfer, so a re-entrant
     * claim issued during the transfer sees it as already claimed.
     *
     * @throws NoRewardException          if the caller has no reward (or a zero reward) for the order
     * @throws StateConflictException     if the reward was already claimed
     * @throws InsufficientFundsException if the reward account cannot pay
     */
    @Override
    @Transactional
    public long claim(Long orderId, String callerId) {
        RewardRecord record = rewardRecordRepository.findByOrderIdAndRetailerId(orderId, callerId)
                .filter(r -> r.getAmount() > 0)
                .orElseThrow(() -> new NoRewardException(
                        String.format("No reward for participant %s on order %d", callerId, orderId)));

        if (record.isClaimed()) {
            throw new StateConflictException(
                    String.format("Reward for participant %s on order %d already claimed", callerId, orderId));
        }

        record.setClaimed(true);
        record.setClaimedAt(LocalDateTime.now(clock));
        rewardRecordRepository.saveAndFlush(record);

        if (!rewardPort.transfer(callerId, record.getAmount())) {
            throw new InsufficientFundsException(String.format(
                    "Reward account %s cannot pay %d to %s", rewardAccount(), record.getAmount(), callerId));
        }

        eventPublisher.publishEvent(new RewardClaimed(orderId, callerId, record.getAmount()));
        log.info("Reward claimed: orderId={}, retailer={}, amount={}", orderId, callerId, record.getAmount());

        return record.getAmount();
    }

    @Override
    public Optional<RewardRecord> findReward(Long orderId, String retailerId) {
        return rewardRecordRepository.findByOrderIdAndRetailerId(orderId, retailerId);
    }

    @Override
    public List<RewardRecord> listRewards(Long orderId) {
        return rewardRecordRepository.findByOrderIdOrderByIdAsc(orderId);
    }
}

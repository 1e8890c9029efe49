package com.nosota.groupbuy.service;

import com.nosota.groupbuy.error.InvalidParametersException;
import com.nosota.groupbuy.error.ServiceNotConfiguredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Global, administrator-managed parameters of the ledger.
 *
 * <p>Holds the platform fee and reward rates, the fee recipient and the downstream
 * services used at settlement. Values are read when a settlement executes, so a
 * change only affects later settlements.
 *
 * <p>Configuration:
 * <pre>
 * groupbuy:
 *   ledger:
 *     platform-fee-bps: 100            # 1%
 *     reward-bps: 50                   # 0.5%
 *     fee-recipient: platform-treasury
 *     operator-account: platform-operator
 *     administrators: admin            # comma-separated
 *     attach-services-on-startup: true
 * </pre>
 *
 * <p>The admin API writes under the {@link ExecutionGuard}; fields are volatile so
 * queries outside the guard see the latest value.
 */
@Component
@Slf4j
public class LedgerParameters {

    private final SettlementCalculator settlementCalculator;
    private final RewardDistributor rewardDistributor;
    private final Set<String> administrators;
    private final String operatorAccount;

    private volatile int platformFeeBps;
    private volatile int rewardBps;
    private volatile String feeRecipient;
    private volatile boolean servicesAttached;

    public LedgerParameters(SettlementCalculator settlementCalculator,
                            RewardDistributor rewardDistributor,
                            @Value("${groupbuy.ledger.platform-fee-bps:100}") int platformFeeBps,
                            @Value("${groupbuy.ledger.reward-bps:50}") int rewardBps,
                            @Value("${groupbuy.ledger.fee-recipient:platform-treasury}") String feeRecipient,
                            @Value("${groupbuy.ledger.operator-account:platform-operator}") String operatorAccount,
                            @Value("${groupbuy.ledger.administrators:}") String[] administrators,
                            @Value("${groupbuy.ledger.attach-services-on-startup:true}") boolean attachOnStartup) {
        requireBasisPoints("platformFeeBps", platformFeeBps);
        requireBasisPoints("rewardBps", rewardBps);
        requireAccount("feeRecipient", feeRecipient);

        this.settlementCalculator = settlementCalculator;
        this.rewardDistributor = rewardDistributor;
        this.platformFeeBps = platformFeeBps;
        this.rewardBps = rewardBps;
        this.feeRecipient = feeRecipient;
        this.operatorAccount = operatorAccount;
        this.administrators = Arrays.stream(administrators)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.servicesAttached = attachOnStartup;

        log.info("Ledger parameters: platformFeeBps={}, rewardBps={}, feeRecipient={}, administrators={}, servicesAttached={}",
                platformFeeBps, rewardBps, feeRecipient, this.administrators, attachOnStartup);
    }

    public int getPlatformFeeBps() {
        return platformFeeBps;
    }

    public int getRewardBps() {
        return rewardBps;
    }

    public String getFeeRecipient() {
        return feeRecipient;
    }

    public String getOperatorAccount() {
        return operatorAccount;
    }

    public boolean servicesAttached() {
        return servicesAttached;
    }

    /**
     * Updates the global rates and fee recipient. A null argument keeps the current value.
     *
     * @throws InvalidParametersException if a rate is outside 0..10000 or the recipient is blank
     */
    public synchronized void update(Integer newPlatformFeeBps, Integer newRewardBps, String newFeeRecipient) {
        if (newPlatformFeeBps != null) {
            requireBasisPoints("platformFeeBps", newPlatformFeeBps);
        }
        if (newRewardBps != null) {
            requireBasisPoints("rewardBps", newRewardBps);
        }
        if (newFeeRecipient != null) {
            requireAccount("feeRecipient", newFeeRecipient);
        }

        if (newPlatformFeeBps != null) {
            platformFeeBps = newPlatformFeeBps;
        }
        if (newRewardBps != null) {
            rewardBps = newRewardBps;
        }
        if (newFeeRecipient != null) {
            feeRecipient = newFeeRecipient;
        }

        log.info("Ledger parameters updated: platformFeeBps={}, rewardBps={}, feeRecipient={}",
                platformFeeBps, rewardBps, feeRecipient);
    }

    public void attachServices() {
        servicesAttached = true;
        log.info("Settlement calculator and reward distributor attached");
    }

    public void detachServices() {
        servicesAttached = false;
        log.warn("Settlement calculator and reward distributor detached, fulfillment disabled");
    }

    /**
     * @throws ServiceNotConfiguredException if services are detached
     */
    public SettlementCalculator requireSettlementCalculator() {
        if (!servicesAttached) {
            throw new ServiceNotConfiguredException("Settlement calculator is not configured");
        }
        return settlementCalculator;
    }

    /**
     * @throws ServiceNotConfiguredException if services are detached
     */
    public RewardDistributor requireRewardDistributor() {
        if (!servicesAttached) {
            throw new ServiceNotConfiguredException("Reward distributor is not configured");
        }
        return rewardDistributor;
    }

    /**
     * Checks whether a participant may perform administrative actions.
     * The platform operator account is always an administrator.
     */
    public boolean isAdministrator(String participantId) {
        return participantId != null
                && (administrators.contains(participantId) || participantId.equals(operatorAccount));
    }

    private static void requireBasisPoints(String name, int value) {
        if (value < 0 || value > PricingEngine.BASIS_POINTS) {
            throw new InvalidParametersException(
                    String.format("%s must be between 0 and %d, got %d", name, PricingEngine.BASIS_POINTS, value));
        }
    }

    private static void requireAccount(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParametersException(name + " must not be blank");
        }
    }
}

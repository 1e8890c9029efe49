package com.nosota.groupbuy.config;

import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.transfer.AccountTransferPort;
import com.nosota.groupbuy.transfer.TokenAccountService;
import com.nosota.groupbuy.transfer.ValueTransferPort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Value-transfer ports used by the ledger and the reward distributor.
 *
 * <p>Configuration:
 * <pre>
 * groupbuy:
 *   ledger:
 *     custody-account: ledger-custody        # holds prepayments and stakes
 *     reward-reserve-account: reward-reserve # funds reward pools
 *   distributor:
 *     account: reward-distributor            # holds funded, unclaimed rewards
 * </pre>
 */
@Configuration
public class ValueTransferConfig {

    @Bean
    public ValueTransferPort ledgerPaymentPort(
            TokenAccountService tokenAccountService,
            @Value("${groupbuy.ledger.custody-account:ledger-custody}") String custodyAccount) {
        return new AccountTransferPort(Asset.PAYMENT, custodyAccount, tokenAccountService);
    }

    @Bean
    public ValueTransferPort ledgerRewardPort(
            TokenAccountService tokenAccountService,
            @Value("${groupbuy.ledger.custody-account:ledger-custody}") String custodyAccount) {
        return new AccountTransferPort(Asset.REWARD, custodyAccount, tokenAccountService);
    }

    @Bean
    public ValueTransferPort rewardReservePort(
            TokenAccountService tokenAccountService,
            @Value("${groupbuy.ledger.reward-reserve-account:reward-reserve}") String reserveAccount) {
        return new AccountTransferPort(Asset.REWARD, reserveAccount, tokenAccountService);
    }

    @Bean
    public ValueTransferPort distributorRewardPort(
            TokenAccountService tokenAccountService,
            @Value("${groupbuy.distributor.account:reward-distributor}") String distributorAccount) {
        return new AccountTransferPort(Asset.REWARD, distributorAccount, tokenAccountService);
    }
}

package com.nosota.groupbuy.transfer;

import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.model.TokenAccount;
import com.nosota.groupbuy.repository.TokenAccountRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * In-process token account store standing in for the external value-transfer service.
 *
 * <p>The service provides:
 * <ul>
 *   <li>Balance queries per (asset, account)</li>
 *   <li>Atomic moves between accounts of the same asset</li>
 *   <li>Deposits from outside the system (funding participants and reserves)</li>
 * </ul>
 *
 * <p>Accounts are created lazily with a zero balance on first credit.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TokenAccountService {

    private final TokenAccountRepository tokenAccountRepository;

    /**
     * Gets the balance of an account, 0 for an unknown account.
     */
    public long balanceOf(@NotNull Asset asset, @NotBlank String accountId) {
        return tokenAccountRepository.findByAssetAndAccountId(asset, accountId)
                .map(TokenAccount::getBalance)
                .orElse(0L);
    }

    /**
     * Moves an amount between two accounts of the same asset.
     *
     * <p>Both rows are write-locked for the rest of the caller's transaction.
     * A zero amount always succeeds without touching any row.
     *
     * @param asset  Asset to move
     * @param from   Source account
     * @param to     Destination account
     * @param amount Amount to move
     * @return true if moved, false if the source balance is insufficient
     */
    @Transactional
    public boolean move(@NotNull Asset asset, @NotBlank String from, @NotBlank String to,
                        @PositiveOrZero long amount) {
        if (amount == 0) {
            return true;
        }

        TokenAccount source = tokenAccountRepository.findForUpdate(asset, from).orElse(null);
        if (source == null || source.getBalance() < amount) {
            log.warn("Transfer refused: asset={}, from={}, to={}, amount={}, available={}",
                    asset, from, to, amount, source == null ? 0L : source.getBalance());
            return false;
        }

        source.setBalance(source.getBalance() - amount);
        tokenAccountRepository.save(source);

        TokenAccount destination = lockOrCreate(asset, to);
        destination.setBalance(Math.addExact(destination.getBalance(), amount));
        tokenAccountRepository.save(destination);

        log.info("Transferred: asset={}, from={}, to={}, amount={}", asset, from, to, amount);
        return true;
    }

    /**
     * Credits an account from outside the system.
     *
     * @return Balance after the deposit
     */
    @Transactional
    public long deposit(@NotNull Asset asset, @NotBlank String accountId, @Positive long amount) {
        TokenAccount account = lockOrCreate(asset, accountId);
        account.setBalance(Math.addExact(account.getBalance(), amount));
        tokenAccountRepository.save(account);

        log.info("Deposited: asset={}, accountId={}, amount={}, balance={}",
                asset, accountId, amount, account.getBalance());
        return account.getBalance();
    }

    private TokenAccount lockOrCreate(Asset asset, String accountId) {
        return tokenAccountRepository.findForUpdate(asset, accountId)
                .orElseGet(() -> tokenAccountRepository.save(new TokenAccount(null, asset, accountId, 0L)));
    }
}

package com.nosota.groupbuy.api;

import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.api.request.DepositRequest;
import com.nosota.groupbuy.api.response.BalanceResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Account API for the sandbox value-transfer adapter.
 *
 * <p>The ledger treats value transfer as an external service. The service module
 * ships an in-process token account store so it can run standalone; these endpoints
 * fund accounts and query balances in that store.
 */
@RequestMapping("/api/v1/accounts")
public interface AccountApi {

    /**
     * Gets the balance of an account.
     *
     * @param asset     PAYMENT or REWARD
     * @param accountId Account identifier
     * @return Balance response
     */
    @GetMapping("/{asset}/{accountId}/balance")
    ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("asset") Asset asset,
            @PathVariable("accountId") String accountId);

    /**
     * Credits an account from outside the system. Administrators only.
     *
     * @param participantId Administrator identifier
     * @param asset         PAYMENT or REWARD
     * @param accountId     Account identifier
     * @param request       Amount to credit
     * @return Balance after the deposit
     */
    @PostMapping("/{asset}/{accountId}/deposit")
    ResponseEntity<BalanceResponse> deposit(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @PathVariable("asset") Asset asset,
            @PathVariable("accountId") String accountId,
            @RequestBody @Valid DepositRequest request);
}

package com.nosota.groupbuy.controller;

import com.nosota.groupbuy.api.AccountApi;
import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.api.request.DepositRequest;
import com.nosota.groupbuy.api.response.BalanceResponse;
import com.nosota.groupbuy.transfer.TokenAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the sandbox token accounts.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AccountController implements AccountApi {

    private final TokenAccountService tokenAccountService;

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Asset asset, String accountId) {
        long balance = tokenAccountService.balanceOf(asset, accountId);
        return ResponseEntity.ok(new BalanceResponse(asset, accountId, balance));
    }

    @Override
    public ResponseEntity<BalanceResponse> deposit(String participantId, Asset asset, String accountId,
                                                   DepositRequest request) {
        long balance = tokenAccountService.deposit(asset, accountId, request.amount());
        log.info("Deposit by {}: asset={}, accountId={}, amount={}", participantId, asset, accountId, request.amount());
        return ResponseEntity.ok(new BalanceResponse(asset, accountId, balance));
    }
}

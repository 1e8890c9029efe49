package com.nosota.groupbuy.api;

import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.api.request.DepositRequest;
import com.nosota.groupbuy.api.response.BalanceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of AccountApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link OrderClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class AccountClient implements AccountApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Asset asset, String accountId) {
        log.debug("Calling getBalance: asset={}, accountId={}", asset, accountId);

        return webClient.get()
                .uri("/api/v1/accounts/{asset}/{accountId}/balance", asset, accountId)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> deposit(String participantId, Asset asset, String accountId,
                                                   DepositRequest request) {
        log.debug("Calling deposit: asset={}, accountId={}, amount={}", asset, accountId, request.amount());

        return webClient.post()
                .uri("/api/v1/accounts/{asset}/{accountId}/deposit", asset, accountId)
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .bodyValue(request)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }
}

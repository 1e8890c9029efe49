package com.nosota.groupbuy.controller;

import com.nosota.groupbuy.api.AdminApi;
import com.nosota.groupbuy.api.request.UpdateParametersRequest;
import com.nosota.groupbuy.api.response.ParametersResponse;
import com.nosota.groupbuy.service.ExecutionGuard;
import com.nosota.groupbuy.service.LedgerParameters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for administrative ledger parameters.
 *
 * <p>Access is restricted to administrators by the security configuration. Changes are
 * serialized with ledger operations, so a settlement in progress keeps the rates it read.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminController implements AdminApi {

    private final LedgerParameters ledgerParameters;
    private final ExecutionGuard executionGuard;

    @Override
    public ResponseEntity<ParametersResponse> getParameters(String participantId) {
        return ResponseEntity.ok(toResponse());
    }

    @Override
    public ResponseEntity<ParametersResponse> updateParameters(String participantId, UpdateParametersRequest request) {
        log.info("Parameter update requested by {}: platformFeeBps={}, rewardBps={}, feeRecipient={}",
                participantId, request.platformFeeBps(), request.rewardBps(), request.feeRecipient());
        executionGuard.run("updateParameters", () -> ledgerParameters.update(
                request.platformFeeBps(), request.rewardBps(), request.feeRecipient()));
        return ResponseEntity.ok(toResponse());
    }

    @Override
    public ResponseEntity<ParametersResponse> attachServices(String participantId) {
        log.info("Service attach requested by {}", participantId);
        executionGuard.run("attachServices", ledgerParameters::attachServices);
        return ResponseEntity.ok(toResponse());
    }

    @Override
    public ResponseEntity<ParametersResponse> detachServices(String participantId) {
        log.info("Service detach requested by {}", participantId);
        executionGuard.run("detachServices", ledgerParameters::detachServices);
        return ResponseEntity.ok(toResponse());
    }

    private ParametersResponse toResponse() {
        return new ParametersResponse(
                ledgerParameters.getPlatformFeeBps(),
                ledgerParameters.getRewardBps(),
                ledgerParameters.getFeeRecipient(),
                ledgerParameters.servicesAttached()
        );
    }
}

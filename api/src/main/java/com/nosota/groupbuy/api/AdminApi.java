package com.nosota.groupbuy.api;

import com.nosota.groupbuy.api.request.UpdateParametersRequest;
import com.nosota.groupbuy.api.response.ParametersResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Administrative API: global settlement parameters and downstream service wiring.
 *
 * <p>All endpoints require an administrator identity in {@link ApiHeaders#PARTICIPANT_ID}.
 */
@RequestMapping("/api/v1/admin")
public interface AdminApi {

    @GetMapping("/parameters")
    ResponseEntity<ParametersResponse> getParameters(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId);

    /**
     * Updates the platform fee, reward share and fee recipient.
     * Applies to every settlement executed afterwards.
     */
    @PutMapping("/parameters")
    ResponseEntity<ParametersResponse> updateParameters(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @RequestBody @Valid UpdateParametersRequest request);

    /**
     * Attaches the settlement calculator and reward distributor.
     */
    @PostMapping("/services/attach")
    ResponseEntity<ParametersResponse> attachServices(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId);

    /**
     * Detaches the settlement calculator and reward distributor.
     * Fulfillment is refused until they are attached again.
     */
    @PostMapping("/services/detach")
    ResponseEntity<ParametersResponse> detachServices(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId);
}

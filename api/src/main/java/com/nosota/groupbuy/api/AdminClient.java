package com.nosota.groupbuy.api;

import com.nosota.groupbuy.api.request.UpdateParametersRequest;
import com.nosota.groupbuy.api.response.ParametersResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of AdminApi.
 */
@RequiredArgsConstructor
@Slf4j
public class AdminClient implements AdminApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<ParametersResponse> getParameters(String participantId) {
        return webClient.get()
                .uri("/api/v1/admin/parameters")
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(ParametersResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ParametersResponse> updateParameters(String participantId, UpdateParametersRequest request) {
        log.debug("Calling updateParameters: feeBps={}, rewardBps={}, feeRecipient={}",
                request.platformFeeBps(), request.rewardBps(), request.feeRecipient());

        return webClient.put()
                .uri("/api/v1/admin/parameters")
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ParametersResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ParametersResponse> attachServices(String participantId) {
        log.debug("Calling attachServices");

        return webClient.post()
                .uri("/api/v1/admin/services/attach")
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(ParametersResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ParametersResponse> detachServices(String participantId) {
        log.debug("Calling detachServices");

        return webClient.post()
                .uri("/api/v1/admin/services/detach")
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(ParametersResponse.class)
                .block();
    }
}

package com.nosota.groupbuy.api;

import com.nosota.groupbuy.api.dto.ContributionDTO;
import com.nosota.groupbuy.api.dto.NotificationDTO;
import com.nosota.groupbuy.api.dto.PagedResponse;
import com.nosota.groupbuy.api.dto.RewardDTO;
import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.api.request.CreateOrderRequest;
import com.nosota.groupbuy.api.request.JoinOrderRequest;
import com.nosota.groupbuy.api.response.ClaimResponse;
import com.nosota.groupbuy.api.response.OrderResponse;
import com.nosota.groupbuy.api.response.SettlementResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of OrderApi for consuming the group-buy ledger.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class GroupBuyClientConfig {
 *     @Bean
 *     public WebClient groupBuyWebClient(WebClient.Builder builder,
 *                                        @Value("${services.group-buy.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public OrderClient orderClient(WebClient groupBuyWebClient) {
 *         return new OrderClient(groupBuyWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class OrderClient implements OrderApi {

    private final WebClient webClient;

    // ==================== Lifecycle Operations ====================

    @Override
    public ResponseEntity<OrderResponse> createOrder(String participantId, CreateOrderRequest request) {
        log.debug("Calling createOrder: manufacturer={}, productId={}, minUnits={}",
                participantId, request.productId(), request.minUnits());

        return webClient.post()
                .uri("/api/v1/orders")
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderResponse> joinOrder(String participantId, Long orderId, JoinOrderRequest request) {
        log.debug("Calling joinOrder: retailer={}, orderId={}, units={}", participantId, orderId, request.units());

        return webClient.post()
                .uri("/api/v1/orders/{orderId}/join", orderId)
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .bodyValue(request)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> executeFulfillment(String participantId, Long orderId) {
        log.debug("Calling executeFulfillment: caller={}, orderId={}", participantId, orderId);

        return webClient.post()
                .uri("/api/v1/orders/{orderId}/fulfill", orderId)
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<OrderResponse> cancelOrder(String participantId, Long orderId) {
        log.debug("Calling cancelOrder: caller={}, orderId={}", participantId, orderId);

        return webClient.post()
                .uri("/api/v1/orders/{orderId}/cancel", orderId)
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ClaimResponse> claimReward(String participantId, Long orderId) {
        log.debug("Calling claimReward: retailer={}, orderId={}", participantId, orderId);

        return webClient.post()
                .uri("/api/v1/orders/{orderId}/rewards/claim", orderId)
                .header(ApiHeaders.PARTICIPANT_ID, participantId)
                .retrieve()
                .toEntity(ClaimResponse.class)
                .block();
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<OrderResponse> getOrder(Long orderId) {
        log.debug("Calling getOrder: orderId={}", orderId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}", orderId)
                .retrieve()
                .toEntity(OrderResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<OrderResponse>> listOrders(OrderStatus status, int page, int size) {
        log.debug("Calling listOrders: status={}, page={}, size={}", status, page, size);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/orders")
                            .queryParam("page", page)
                            .queryParam("size", size);
                    if (status != null) {
                        uriBuilder.queryParam("status", status);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<OrderResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<ContributionDTO>> getContributions(Long orderId) {
        log.debug("Calling getContributions: orderId={}", orderId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}/contributions", orderId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<ContributionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> previewSettlement(Long orderId) {
        log.debug("Calling previewSettlement: orderId={}", orderId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}/settlement/preview", orderId)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<RewardDTO>> getRewards(Long orderId) {
        log.debug("Calling getRewards: orderId={}", orderId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}/rewards", orderId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<RewardDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<RewardDTO> getReward(Long orderId, String retailerId) {
        log.debug("Calling getReward: orderId={}, retailerId={}", orderId, retailerId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}/rewards/{retailerId}", orderId, retailerId)
                .retrieve()
                .toEntity(RewardDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<NotificationDTO>> getNotifications(Long orderId) {
        log.debug("Calling getNotifications: orderId={}", orderId);

        return webClient.get()
                .uri("/api/v1/orders/{orderId}/notifications", orderId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<NotificationDTO>>() {})
                .block();
    }
}

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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Order API interface for the group-buy ledger.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Order lifecycle (create, join, fulfill, cancel)</li>
 *   <li>Reward claims after settlement</li>
 *   <li>Read-only queries (order state, contributions, rewards, notifications)</li>
 * </ul>
 *
 * <p>State-changing endpoints identify the caller by the {@link ApiHeaders#PARTICIPANT_ID} header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>OrderController - in service module (server-side implementation)</li>
 *   <li>OrderClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/orders")
public interface OrderApi {

    // ==================== Lifecycle Operations ====================

    /**
     * Posts a new order. The caller becomes the order's manufacturer.
     *
     * @param participantId Manufacturer identifier
     * @param request       Order parameters
     * @return Created order
     */
    @PostMapping
    ResponseEntity<OrderResponse> createOrder(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @RequestBody @Valid CreateOrderRequest request);

    /**
     * Commits units to an open order and prepays them at the current unit price.
     *
     * @param participantId Retailer identifier
     * @param orderId       Order ID
     * @param request       Units to commit
     * @return Order state after the join
     */
    @PostMapping("/{orderId}/join")
    ResponseEntity<OrderResponse> joinOrder(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @PathVariable("orderId") Long orderId,
            @RequestBody @Valid JoinOrderRequest request);

    /**
     * Settles an order whose minimum units threshold has been reached.
     *
     * @param participantId Caller identifier
     * @param orderId       Order ID
     * @return Executed settlement figures
     */
    @PostMapping("/{orderId}/fulfill")
    ResponseEntity<SettlementResponse> executeFulfillment(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @PathVariable("orderId") Long orderId);

    /**
     * Cancels an expired order that did not reach its threshold and refunds all contributions.
     *
     * @param participantId Manufacturer or administrator identifier
     * @param orderId       Order ID
     * @return Order state after cancellation
     */
    @PostMapping("/{orderId}/cancel")
    ResponseEntity<OrderResponse> cancelOrder(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @PathVariable("orderId") Long orderId);

    /**
     * Claims the caller's reward for a settled order.
     *
     * @param participantId Retailer identifier
     * @param orderId       Order ID
     * @return Claimed amount
     */
    @PostMapping("/{orderId}/rewards/claim")
    ResponseEntity<ClaimResponse> claimReward(
            @RequestHeader(ApiHeaders.PARTICIPANT_ID) String participantId,
            @PathVariable("orderId") Long orderId);

    // ==================== Queries ====================

    @GetMapping("/{orderId}")
    ResponseEntity<OrderResponse> getOrder(
            @PathVariable("orderId") Long orderId);

    /**
     * Lists orders with pagination, newest first.
     *
     * @param status Optional status filter
     * @param page   Page number (0-indexed)
     * @param size   Page size
     * @return Paginated list of orders
     */
    @GetMapping
    ResponseEntity<PagedResponse<OrderResponse>> listOrders(
            @RequestParam(name = "status", required = false) OrderStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    /**
     * Gets all contributions of an order in join order.
     */
    @GetMapping("/{orderId}/contributions")
    ResponseEntity<List<ContributionDTO>> getContributions(
            @PathVariable("orderId") Long orderId);

    /**
     * Previews the settlement of an open order using the current global parameters.
     * Nothing is transferred.
     */
    @GetMapping("/{orderId}/settlement/preview")
    ResponseEntity<SettlementResponse> previewSettlement(
            @PathVariable("orderId") Long orderId);

    @GetMapping("/{orderId}/rewards")
    ResponseEntity<List<RewardDTO>> getRewards(
            @PathVariable("orderId") Long orderId);

    @GetMapping("/{orderId}/rewards/{retailerId}")
    ResponseEntity<RewardDTO> getReward(
            @PathVariable("orderId") Long orderId,
            @PathVariable("retailerId") String retailerId);

    /**
     * Gets the notifications emitted for an order, in emission order.
     */
    @GetMapping("/{orderId}/notifications")
    ResponseEntity<List<NotificationDTO>> getNotifications(
            @PathVariable("orderId") Long orderId);
}

package com.nosota.groupbuy.controller;

import com.nosota.groupbuy.api.OrderApi;
import com.nosota.groupbuy.api.dto.ContributionDTO;
import com.nosota.groupbuy.api.dto.NotificationDTO;
import com.nosota.groupbuy.api.dto.PagedResponse;
import com.nosota.groupbuy.api.dto.RefundDTO;
import com.nosota.groupbuy.api.dto.RewardDTO;
import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.api.request.CreateOrderRequest;
import com.nosota.groupbuy.api.request.JoinOrderRequest;
import com.nosota.groupbuy.api.response.ClaimResponse;
import com.nosota.groupbuy.api.response.OrderResponse;
import com.nosota.groupbuy.api.response.SettlementResponse;
import com.nosota.groupbuy.dto.FulfillmentResult;
import com.nosota.groupbuy.dto.NewOrder;
import com.nosota.groupbuy.dto.SettlementOutcome;
import com.nosota.groupbuy.mapper.OrderMapper;
import com.nosota.groupbuy.model.PurchaseOrder;
import com.nosota.groupbuy.service.OrderLedgerService;
import com.nosota.groupbuy.service.OrderQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the group-buy order lifecycle.
 *
 * <p>Implements {@link OrderApi}. Mutations go through {@link OrderLedgerService},
 * queries through {@link OrderQueryService}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderController implements OrderApi {

    private final OrderLedgerService orderLedgerService;
    private final OrderQueryService orderQueryService;

    // ==================== Lifecycle Operations ====================

    @Override
    public ResponseEntity<OrderResponse> createOrder(String participantId, CreateOrderRequest request) {
        NewOrder newOrder = NewOrder.builder()
                .productId(request.productId())
                .minUnits(request.minUnits())
                .initialPrice(request.initialPrice())
                .discountTiers(request.discountTiers() == null
                        ? List.of()
                        : OrderMapper.INSTANCE.toDiscountTiers(request.discountTiers()))
                .stakeAmount(request.stakeAmount() == null ? 0L : request.stakeAmount())
                .durationSeconds(request.durationSeconds())
                .build();

        PurchaseOrder order = orderLedgerService.createOrder(participantId, newOrder);
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderMapper.INSTANCE.toResponse(order));
    }

    @Override
    public ResponseEntity<OrderResponse> joinOrder(String participantId, Long orderId, JoinOrderRequest request) {
        orderLedgerService.joinOrder(participantId, orderId, request.units());
        PurchaseOrder order = orderQueryService.getOrder(orderId);
        return ResponseEntity.ok(OrderMapper.INSTANCE.toResponse(order));
    }

    @Override
    public ResponseEntity<SettlementResponse> executeFulfillment(String participantId, Long orderId) {
        SettlementOutcome outcome = orderLedgerService.executeFulfillment(participantId, orderId);
        return ResponseEntity.ok(toSettlementResponse(outcome));
    }

    @Override
    public ResponseEntity<OrderResponse> cancelOrder(String participantId, Long orderId) {
        PurchaseOrder order = orderLedgerService.cancelOrder(participantId, orderId);
        return ResponseEntity.ok(OrderMapper.INSTANCE.toResponse(order));
    }

    @Override
    public ResponseEntity<ClaimResponse> claimReward(String participantId, Long orderId) {
        long amount = orderLedgerService.claimReward(participantId, orderId);
        return ResponseEntity.ok(new ClaimResponse(orderId, participantId, amount));
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<OrderResponse> getOrder(Long orderId) {
        return ResponseEntity.ok(OrderMapper.INSTANCE.toResponse(orderQueryService.getOrder(orderId)));
    }

    @Override
    public ResponseEntity<PagedResponse<OrderResponse>> listOrders(OrderStatus status, int page, int size) {
        Page<PurchaseOrder> orders = orderQueryService.listOrders(status, PageRequest.of(page, size));

        List<OrderResponse> content = orders.getContent().stream()
                .map(OrderMapper.INSTANCE::toResponse)
                .toList();

        PagedResponse<OrderResponse> response = new PagedResponse<>(
                content,
                orders.getNumber(),
                orders.getSize(),
                (int) orders.getTotalElements()
        );

        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<List<ContributionDTO>> getContributions(Long orderId) {
        return ResponseEntity.ok(
                OrderMapper.INSTANCE.toContributionDTOList(orderQueryService.getContributions(orderId)));
    }

    @Override
    public ResponseEntity<SettlementResponse> previewSettlement(Long orderId) {
        return ResponseEntity.ok(toSettlementResponse(orderQueryService.previewSettlement(orderId)));
    }

    @Override
    public ResponseEntity<List<RewardDTO>> getRewards(Long orderId) {
        return ResponseEntity.ok(OrderMapper.INSTANCE.toRewardDTOList(orderQueryService.getRewards(orderId)));
    }

    @Override
    public ResponseEntity<RewardDTO> getReward(Long orderId, String retailerId) {
        return ResponseEntity.ok(OrderMapper.INSTANCE.toDTO(orderQueryService.getReward(orderId, retailerId)));
    }

    @Override
    public ResponseEntity<List<NotificationDTO>> getNotifications(Long orderId) {
        return ResponseEntity.ok(
                OrderMapper.INSTANCE.toNotificationDTOList(orderQueryService.getNotifications(orderId)));
    }

    // ==================== Helper Methods ====================

    private SettlementResponse toSettlementResponse(SettlementOutcome outcome) {
        FulfillmentResult result = outcome.result();
        List<RefundDTO> refunds = result.refunds().stream()
                .map(refund -> new RefundDTO(refund.retailerId(), refund.amount()))
                .toList();

        return new SettlementResponse(
                outcome.orderId(),
                result.finalPricePerUnit(),
                result.totalValueForRewardCalc(),
                result.netPaymentToManufacturer(),
                result.platformFeeCollected(),
                outcome.rewardPool(),
                outcome.platformFeeBps(),
                outcome.rewardBps(),
                refunds,
                outcome.status()
        );
    }
}

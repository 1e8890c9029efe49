package com.nosota.groupbuy.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.groupbuy.TestBase;
import com.nosota.groupbuy.api.ApiHeaders;
import com.nosota.groupbuy.api.dto.DiscountTierDTO;
import com.nosota.groupbuy.api.dto.NotificationDTO;
import com.nosota.groupbuy.api.dto.PagedResponse;
import com.nosota.groupbuy.api.model.NotificationType;
import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.api.request.CreateOrderRequest;
import com.nosota.groupbuy.api.request.DepositRequest;
import com.nosota.groupbuy.api.request.JoinOrderRequest;
import com.nosota.groupbuy.api.request.UpdateParametersRequest;
import com.nosota.groupbuy.api.response.OrderResponse;
import com.nosota.groupbuy.api.response.SettlementResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the REST surface via MockMvc, through Spring Security.
 */
@DisplayName("5. Controller Tests")
public class OrderControllerTest extends TestBase {

    private static final CreateOrderRequest REFERENCE_ORDER = new CreateOrderRequest(
            "sku-42", 100L, 10L,
            List.of(new DiscountTierDTO(50L, 500), new DiscountTierDTO(100L, 1000)),
            0L, 3600L);

    @Test
    @DisplayName("API-001: Full flow create → join → fulfill → claim over HTTP")
    void fullFlow_ShouldSucceed() throws Exception {
        String manufacturer = newManufacturer(0L);
        String retailerA = newRetailer(10_000L);
        String retailerB = newRetailer(10_000L);

        OrderResponse created = createOrderViaApi(manufacturer, REFERENCE_ORDER);
        assertThat(created.status()).isEqualTo(OrderStatus.OPEN);
        assertThat(created.manufacturerId()).isEqualTo(manufacturer);
        assertThat(created.discountTiers()).containsExactly(
                new DiscountTierDTO(50L, 500), new DiscountTierDTO(100L, 1000));

        joinViaApi(retailerA, created.id(), 60L);
        OrderResponse joined = joinViaApi(retailerB, created.id(), 40L);
        assertThat(joined.currentPrice()).isEqualTo(9L);
        assertThat(joined.totalUnitsCommitted()).isEqualTo(100L);

        MvcResult fulfillResult = mockMvc.perform(post("/api/v1/orders/{orderId}/fulfill", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailerA))
                .andExpect(status().isOk())
                .andReturn();
        SettlementResponse settlement = objectMapper.readValue(
                fulfillResult.getResponse().getContentAsString(), SettlementResponse.class);

        assertThat(settlement.status()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(settlement.grossValue()).isEqualTo(900L);
        assertThat(settlement.netPaymentToManufacturer()).isEqualTo(891L);
        assertThat(settlement.platformFeeCollected()).isEqualTo(9L);
        assertThat(settlement.rewardPool()).isEqualTo(4L);
        assertThat(settlement.refunds()).hasSize(2);

        mockMvc.perform(post("/api/v1/orders/{orderId}/rewards/claim", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailerA))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(2));

        mockMvc.perform(post("/api/v1/orders/{orderId}/rewards/claim", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailerA))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("State Conflict"));

        mockMvc.perform(get("/api/v1/orders/{orderId}/rewards/{retailerId}", created.id(), retailerA))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claimed").value(true));

        MvcResult notificationsResult = mockMvc.perform(get("/api/v1/orders/{orderId}/notifications", created.id()))
                .andExpect(status().isOk())
                .andReturn();
        List<NotificationDTO> notifications = objectMapper.readValue(
                notificationsResult.getResponse().getContentAsString(), new TypeReference<>() {});
        assertThat(notifications).extracting(NotificationDTO::type)
                .startsWith(NotificationType.ORDER_CREATED)
                .endsWith(NotificationType.ORDER_PROCESSED, NotificationType.REWARD_CLAIMED);
    }

    @Test
    @DisplayName("API-002: Mutations without a participant header are forbidden")
    void createOrder_WithoutParticipant_ShouldReturn403() throws Exception {
        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(REFERENCE_ORDER)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("API-003: Queries are open and respond with a correlation id")
    void getOrder_ShouldBePublic() throws Exception {
        OrderResponse created = createOrderViaApi(newManufacturer(0L), REFERENCE_ORDER);

        mockMvc.perform(get("/api/v1/orders/{orderId}", created.id())
                        .header(ApiHeaders.CORRELATION_ID, "test-correlation"))
                .andExpect(status().isOk())
                .andExpect(header().string(ApiHeaders.CORRELATION_ID, "test-correlation"))
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.currentPrice").value(10));

        mockMvc.perform(get("/api/v1/orders/{orderId}/settlement/preview", created.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.grossValue").value(0));
    }

    @Test
    @DisplayName("API-004: Unknown orders return 404")
    void getOrder_WhenNotFound_ShouldReturn404() throws Exception {
        mockMvc.perform(get("/api/v1/orders/{orderId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.correlationId", notNullValue()));
    }

    @Test
    @DisplayName("API-005: Request validation and ledger errors map to their HTTP statuses")
    void errors_ShouldMapToStatuses() throws Exception {
        String manufacturer = newManufacturer(0L);
        OrderResponse created = createOrderViaApi(manufacturer, REFERENCE_ORDER);
        String retailer = newRetailer(10L);

        mockMvc.perform(post("/api/v1/orders/{orderId}/join", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new JoinOrderRequest(0L))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/orders/{orderId}/join", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new JoinOrderRequest(5L))))
                .andExpect(status().isPaymentRequired());

        mockMvc.perform(post("/api/v1/orders/{orderId}/fulfill", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailer))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/orders/{orderId}/cancel", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailer))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(post("/api/v1/orders/{orderId}/cancel", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, manufacturer))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(post("/api/v1/orders/{orderId}/rewards/claim", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, retailer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No Reward"));

        CreateOrderRequest invalid = new CreateOrderRequest("", 0L, 10L, List.of(), 0L, 60L);
        mockMvc.perform(post("/api/v1/orders")
                        .header(ApiHeaders.PARTICIPANT_ID, manufacturer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(invalid)))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("API-006: Cancel after deadline over HTTP")
    void cancelOrder_AfterDeadline_ShouldRefund() throws Exception {
        String manufacturer = newManufacturer(0L);
        String retailer = newRetailer(1_000L);
        OrderResponse created = createOrderViaApi(manufacturer, REFERENCE_ORDER);
        joinViaApi(retailer, created.id(), 10L);

        clock.advance(Duration.ofSeconds(3601));

        mockMvc.perform(post("/api/v1/orders/{orderId}/cancel", created.id())
                        .header(ApiHeaders.PARTICIPANT_ID, manufacturer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(get("/api/v1/accounts/{asset}/{accountId}/balance", "PAYMENT", retailer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(1_000));
    }

    @Test
    @DisplayName("API-007: Admin endpoints require an administrator")
    void adminEndpoints_ShouldRequireAdmin() throws Exception {
        String participant = newParticipant("participant");
        UpdateParametersRequest update = new UpdateParametersRequest(200, 75, null);

        mockMvc.perform(get("/api/v1/admin/parameters")
                        .header(ApiHeaders.PARTICIPANT_ID, participant))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/v1/admin/parameters")
                        .header(ApiHeaders.PARTICIPANT_ID, participant)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(update)))
                .andExpect(status().isForbidden());
        assertThat(ledgerParameters.getPlatformFeeBps()).isEqualTo(100);

        mockMvc.perform(put("/api/v1/admin/parameters")
                        .header(ApiHeaders.PARTICIPANT_ID, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(update)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platformFeeBps").value(200))
                .andExpect(jsonPath("$.rewardBps").value(75))
                .andExpect(jsonPath("$.feeRecipient").value(feeRecipient));

        mockMvc.perform(put("/api/v1/admin/parameters")
                        .header(ApiHeaders.PARTICIPANT_ID, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new UpdateParametersRequest(10_001, null, null))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/admin/services/detach")
                        .header(ApiHeaders.PARTICIPANT_ID, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.servicesAttached").value(false));

        mockMvc.perform(post("/api/v1/admin/services/attach")
                        .header(ApiHeaders.PARTICIPANT_ID, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.servicesAttached").value(true));
    }

    @Test
    @DisplayName("API-008: Deposits are reserved to administrators")
    void deposit_ShouldRequireAdmin() throws Exception {
        String account = newParticipant("account");
        String body = objectMapper.writeValueAsString(new DepositRequest(250L));

        mockMvc.perform(post("/api/v1/accounts/{asset}/{accountId}/deposit", "REWARD", account)
                        .header(ApiHeaders.PARTICIPANT_ID, account)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/accounts/{asset}/{accountId}/deposit", "REWARD", account)
                        .header(ApiHeaders.PARTICIPANT_ID, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(250));

        assertThat(rewardBalance(account)).isEqualTo(250L);
    }

    @Test
    @DisplayName("API-009: Orders are listed newest first and filtered by status")
    void listOrders_ShouldFilterByStatus() throws Exception {
        String manufacturer = newManufacturer(0L);
        OrderResponse first = createOrderViaApi(manufacturer, REFERENCE_ORDER);
        OrderResponse second = createOrderViaApi(manufacturer, REFERENCE_ORDER);

        MvcResult result = mockMvc.perform(get("/api/v1/orders")
                        .param("status", "OPEN")
                        .param("page", "0")
                        .param("size", "2"))
                .andExpect(status().isOk())
                .andReturn();
        PagedResponse<OrderResponse> page = objectMapper.readValue(
                result.getResponse().getContentAsString(), new TypeReference<>() {});

        assertThat(page.content()).extracting(OrderResponse::id).containsExactly(second.id(), first.id());
        assertThat(page.content()).allMatch(order -> order.status() == OrderStatus.OPEN);

        mockMvc.perform(get("/api/v1/orders").param("status", "NOT_A_STATUS"))
                .andExpect(status().isBadRequest());
    }

    // ==================== Helper Methods ====================

    private OrderResponse createOrderViaApi(String manufacturer, CreateOrderRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/orders")
                        .header(ApiHeaders.PARTICIPANT_ID, manufacturer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), OrderResponse.class);
    }

    private OrderResponse joinViaApi(String retailer, Long orderId, long units) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/orders/{orderId}/join", orderId)
                        .header(ApiHeaders.PARTICIPANT_ID, retailer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new JoinOrderRequest(units))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), OrderResponse.class);
    }
}

package com.nosota.groupbuy.tests;

import com.nosota.groupbuy.GroupBuyApplication;
import com.nosota.groupbuy.api.AccountClient;
import com.nosota.groupbuy.api.AdminClient;
import com.nosota.groupbuy.api.OrderClient;
import com.nosota.groupbuy.api.dto.PagedResponse;
import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.api.model.OrderStatus;
import com.nosota.groupbuy.api.request.CreateOrderRequest;
import com.nosota.groupbuy.api.request.DepositRequest;
import com.nosota.groupbuy.api.request.JoinOrderRequest;
import com.nosota.groupbuy.api.response.OrderResponse;
import com.nosota.groupbuy.api.response.ParametersResponse;
import com.nosota.groupbuy.api.response.SettlementResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the WebClient clients shipped in the api module against a running server.
 */
@SpringBootTest(
        classes = GroupBuyApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "spring.datasource.url=jdbc:h2:mem:groupbuy-client;DB_CLOSE_DELAY=-1"
)
@Import(TestClockConfig.class)
@ActiveProfiles("test")
@DisplayName("6. Client Tests")
public class ClientIntegrationTest {

    private static final String ADMIN = "admin";

    @LocalServerPort
    private int port;

    private OrderClient orderClient;
    private AccountClient accountClient;
    private AdminClient adminClient;

    @BeforeEach
    void setUpClients() {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://localhost:" + port)
                .build();
        orderClient = new OrderClient(webClient);
        accountClient = new AccountClient(webClient);
        adminClient = new AdminClient(webClient);
    }

    @Test
    void clients_FullFlow_ShouldSucceed() {
        accountClient.deposit(ADMIN, Asset.PAYMENT, "client-retailer", new DepositRequest(1_000L));
        accountClient.deposit(ADMIN, Asset.REWARD, "reward-reserve", new DepositRequest(1_000L));

        OrderResponse order = orderClient.createOrder("client-manufacturer",
                new CreateOrderRequest("sku-client", 10L, 20L, List.of(), 0L, 600L)).getBody();
        assertThat(order).isNotNull();

        orderClient.joinOrder("client-retailer", order.id(), new JoinOrderRequest(10L));

        SettlementResponse preview = orderClient.previewSettlement(order.id()).getBody();
        assertThat(preview).isNotNull();
        assertThat(preview.grossValue()).isEqualTo(200L);

        SettlementResponse settlement = orderClient.executeFulfillment("client-retailer", order.id()).getBody();
        assertThat(settlement).isNotNull();
        assertThat(settlement.status()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(settlement.platformFeeCollected()).isEqualTo(2L);
        assertThat(settlement.rewardPool()).isEqualTo(1L);

        assertThat(orderClient.claimReward("client-retailer", order.id()).getBody().amount()).isEqualTo(1L);
        assertThat(orderClient.getReward(order.id(), "client-retailer").getBody().claimed()).isTrue();
        assertThat(orderClient.getContributions(order.id()).getBody()).hasSize(1);
        assertThat(orderClient.getRewards(order.id()).getBody()).hasSize(1);
        assertThat(orderClient.getNotifications(order.id()).getBody()).isNotEmpty();

        PagedResponse<OrderResponse> fulfilled = orderClient.listOrders(OrderStatus.FULFILLED, 0, 10).getBody();
        assertThat(fulfilled.content()).extracting(OrderResponse::id).contains(order.id());

        assertThat(accountClient.getBalance(Asset.PAYMENT, "client-manufacturer").getBody().balance())
                .isEqualTo(198L);
    }

    @Test
    void clients_ErrorStatus_ShouldSurfaceAsException() {
        assertThatThrownBy(() -> orderClient.getOrder(Long.MAX_VALUE))
                .isInstanceOf(WebClientResponseException.class)
                .satisfies(ex -> assertThat(((WebClientResponseException) ex).getStatusCode())
                        .isEqualTo(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> adminClient.getParameters("not-an-admin"))
                .isInstanceOf(WebClientResponseException.Forbidden.class);
    }

    @Test
    void adminClient_ShouldToggleServices() {
        ParametersResponse detached = adminClient.detachServices(ADMIN).getBody();
        assertThat(detached.servicesAttached()).isFalse();

        ParametersResponse attached = adminClient.attachServices(ADMIN).getBody();
        assertThat(attached.servicesAttached()).isTrue();
        assertThat(adminClient.getParameters(ADMIN).getBody().platformFeeBps()).isEqualTo(100);
    }
}

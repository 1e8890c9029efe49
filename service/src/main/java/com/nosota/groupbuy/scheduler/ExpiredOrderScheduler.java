package com.nosota.groupbuy.scheduler;

import com.nosota.groupbuy.service.OrderLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled cancellation of orders that missed their deadline.
 *
 * <p>Finds OPEN orders whose deadline passed below the minimum units threshold and cancels
 * them as the platform operator, refunding every retailer and returning the stake.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   expired-orders:
 *     enabled: true                 # enable/disable scheduler
 *     cron: "0 * * * * *"           # every minute
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.expired-orders.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ExpiredOrderScheduler {

    private final OrderLedgerService orderLedgerService;

    @Scheduled(cron = "${scheduler.expired-orders.cron:0 * * * * *}")
    public void cancelExpiredOrders() {
        log.debug("Starting scheduled job: cancel expired orders");

        int cancelledCount = orderLedgerService.cancelExpiredOrders();
        if (cancelledCount > 0) {
            log.info("Cancelled {} expired orders", cancelledCount);
        }
    }
}

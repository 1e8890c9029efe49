package com.nosota.groupbuy.api.dto;

import java.time.LocalDateTime;

/**
 * A retailer's commitment to an order.
 *
 * @param retailerId   Retailer identifier
 * @param unitsOrdered Units committed
 * @param amountPaid   Amount prepaid at the unit price current when joining
 * @param joinedAt     Join timestamp
 */
public record ContributionDTO(
        String retailerId,
        Long unitsOrdered,
        Long amountPaid,
        LocalDateTime joinedAt
) {
}

package com.nosota.groupbuy.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for committing units to an open order.
 *
 * @param units Units to commit (must be positive)
 */
public record JoinOrderRequest(
        @NotNull(message = "Units is required")
        @Positive(message = "Units must be positive")
        Long units
) {
}

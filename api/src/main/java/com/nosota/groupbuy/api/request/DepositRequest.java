package com.nosota.groupbuy.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for crediting a sandbox token account.
 *
 * @param amount Amount to credit (must be positive)
 */
public record DepositRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}

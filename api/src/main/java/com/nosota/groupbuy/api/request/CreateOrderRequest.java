package com.nosota.groupbuy.api.request;

import com.nosota.groupbuy.api.dto.DiscountTierDTO;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for posting a new group-buy order.
 *
 * <p>The caller (manufacturer) is taken from the {@code X-Participant-Id} header.
 *
 * @param productId       Opaque product identifier
 * @param minUnits        Minimum committed units required for fulfillment
 * @param initialPrice    Unit price before any discount (payment-asset units)
 * @param discountTiers   Volume discount tiers, frozen at creation (may be empty)
 * @param stakeAmount     Stake deposited by the manufacturer in reward-asset units (0 for none)
 * @param durationSeconds Seconds from creation until the fulfillment deadline
 */
public record CreateOrderRequest(
        @NotBlank(message = "Product ID is required")
        @Size(max = 255, message = "Product ID must be at most 255 characters")
        String productId,

        @NotNull(message = "Minimum units is required")
        @Positive(message = "Minimum units must be positive")
        Long minUnits,

        @NotNull(message = "Initial price is required")
        @Positive(message = "Initial price must be positive")
        Long initialPrice,

        List<@Valid DiscountTierDTO> discountTiers,

        @PositiveOrZero(message = "Stake amount must not be negative")
        Long stakeAmount,

        @NotNull(message = "Duration is required")
        @Positive(message = "Duration must be positive")
        Long durationSeconds
) {
}

package com.nosota.groupbuy.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Volume discount tier.
 *
 * @param unitsThreshold      Committed units from which the tier applies
 * @param discountBasisPoints Discount in basis points (1/10000), 0..10000
 */
public record DiscountTierDTO(
        @NotNull(message = "Units threshold is required")
        @Positive(message = "Units threshold must be positive")
        Long unitsThreshold,

        @NotNull(message = "Discount is required")
        @PositiveOrZero(message = "Discount must not be negative")
        @Max(value = 10000, message = "Discount must not exceed 10000 basis points")
        Integer discountBasisPoints
) {
}

package com.nosota.groupbuy.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for changing the global settlement parameters.
 *
 * <p>Null fields keep their current value. New values apply to settlements
 * executed after the change, including orders already open.
 *
 * @param platformFeeBps Platform fee in basis points
 * @param rewardBps      Reward pool share of the gross value in basis points
 * @param feeRecipient   Account receiving platform fees
 */
public record UpdateParametersRequest(
        @PositiveOrZero(message = "Platform fee must not be negative")
        @Max(value = 10000, message = "Platform fee must not exceed 10000 basis points")
        Integer platformFeeBps,

        @PositiveOrZero(message = "Reward share must not be negative")
        @Max(value = 10000, message = "Reward share must not exceed 10000 basis points")
        Integer rewardBps,

        String feeRecipient
) {
}

package com.nosota.groupbuy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Volume discount tier: orders with at least {@code unitsThreshold} committed units
 * qualify for {@code discountBps} basis points off the initial unit price.
 *
 * <p>Immutable; the tier list of an order is frozen when the order is created.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DiscountTier {

    @Column(name = "units_threshold", nullable = false)
    private long unitsThreshold;

    /**
     * Discount in basis points, 0..10000.
     */
    @Column(name = "discount_bps", nullable = false)
    private int discountBps;
}

package com.nosota.groupbuy.service;

import com.nosota.groupbuy.model.DiscountTier;

import java.util.List;

/**
 * Volume discount resolution.
 *
 * <p>Pure functions without state or side effects. Tier order is irrelevant: the best
 * qualifying discount wins. Inputs are assumed valid (bps &lt;= 10000 is checked when the
 * order is created, not here).
 *
 * <p>Example for tiers {@code [(50, 500), (100, 1000)]} and initial price 10:
 * <pre>
 *   49 units  → 0 bps    → price 10
 *   60 units  → 500 bps  → price 10 - floor(10*500/10000)  = 10
 *   100 units → 1000 bps → price 10 - floor(10*1000/10000) = 9
 * </pre>
 */
public final class PricingEngine {

    public static final long BASIS_POINTS = 10_000L;

    private PricingEngine() {
    }

    /**
     * Resolves the best applicable discount.
     *
     * @param tiers          Discount tiers in any order
     * @param unitsCommitted Units committed so far
     * @return Maximum discountBps among tiers with unitsThreshold &lt;= unitsCommitted, 0 if none
     */
    public static int resolveDiscount(List<DiscountTier> tiers, long unitsCommitted) {
        int best = 0;
        for (DiscountTier tier : tiers) {
            if (tier.getUnitsThreshold() <= unitsCommitted && tier.getDiscountBps() > best) {
                best = tier.getDiscountBps();
            }
        }
        return best;
    }

    /**
     * Applies a discount with truncating rounding of the discount amount.
     *
     * @return price - floor(price * discountBps / 10000)
     */
    public static long applyDiscount(long price, int discountBps) {
        return price - Math.multiplyExact(price, (long) discountBps) / BASIS_POINTS;
    }

    /**
     * Unit price for the given commitment level.
     */
    public static long resolvePrice(long initialPrice, List<DiscountTier> tiers, long unitsCommitted) {
        return applyDiscount(initialPrice, resolveDiscount(tiers, unitsCommitted));
    }

    /**
     * floor(amount * bps / 10000), used for platform fees and reward pools.
     */
    public static long basisPointsOf(long amount, int bps) {
        return Math.multiplyExact(amount, (long) bps) / BASIS_POINTS;
    }
}

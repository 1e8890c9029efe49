package com.nosota.groupbuy.model;

import com.nosota.groupbuy.api.model.OrderStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Group-buy order - one per manufacturer offering.
 *
 * <p>Lifecycle flags:
 * <pre>
 *   OPEN      : active=true,  fulfilled=false
 *   FULFILLED : active=false, fulfilled=true   (terminal)
 *   CANCELLED : active=false, fulfilled=false  (terminal)
 * </pre>
 *
 * <p>Invariants:
 * <ul>
 *   <li>currentPrice &lt;= initialPrice</li>
 *   <li>totalUnitsCommitted equals the sum of the order's contribution units</li>
 *   <li>fulfilled implies !active</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 * minUnits=100, initialPrice=10, tiers=[(50, 500), (100, 1000)]
 *   after 60 units:  currentPrice = 10 - floor(10*500/10000)  = 10
 *   after 100 units: currentPrice = 10 - floor(10*1000/10000) = 9
 * </pre>
 */
@Entity
@Table(name = "purchase_order")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PurchaseOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "manufacturer_id", nullable = false)
    private String manufacturerId;

    /**
     * Opaque product identifier supplied by the manufacturer.
     */
    @Column(name = "product_id", nullable = false)
    private String productId;

    /**
     * Committed units required before the order can be fulfilled.
     */
    @Column(name = "min_units", nullable = false)
    private Long minUnits;

    @Column(name = "initial_price", nullable = false)
    private Long initialPrice;

    /**
     * Discount-adjusted unit price quoted to the next retailer.
     * Non-increasing as units are committed.
     */
    @Column(name = "current_price", nullable = false)
    private Long currentPrice;

    @Column(name = "total_units_committed", nullable = false)
    private Long totalUnitsCommitted;

    /**
     * Sum of all amounts prepaid by retailers, held in the ledger custody account.
     */
    @Column(name = "total_value_collected", nullable = false)
    private Long totalValueCollected;

    /**
     * Stake deposited by the manufacturer in reward-asset units.
     * Returned on fulfillment or cancellation.
     */
    @Column(name = "stake_amount", nullable = false)
    private Long stakeAmount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_discount_tier", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "tier_index")
    private List<DiscountTier> discountTiers = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "deadline", nullable = false)
    private LocalDateTime deadline;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "fulfilled", nullable = false)
    private boolean fulfilled;

    public OrderStatus getStatus() {
        if (fulfilled) {
            return OrderStatus.FULFILLED;
        }
        return active ? OrderStatus.OPEN : OrderStatus.CANCELLED;
    }

    public boolean isThresholdReached() {
        return totalUnitsCommitted >= minUnits;
    }

    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(deadline);
    }
}

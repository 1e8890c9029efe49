package com.nosota.groupbuy.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A retailer's commitment to an order.
 *
 * <p>At most one contribution exists per (order, retailer); a second join by the same
 * retailer is rejected rather than merged. Contributions are appended and never changed:
 * refunds at settlement or cancellation are value transfers, not field updates.
 */
@Entity
@Table(name = "contribution",
        uniqueConstraints = @UniqueConstraint(name = "uk_contribution_order_retailer",
                columnNames = {"order_id", "retailer_id"}),
        indexes = @Index(name = "idx_contribution_order", columnList = "order_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Contribution {

    /**
     * Generated in join order; contribution lists are sorted by it.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "retailer_id", nullable = false)
    private String retailerId;

    @Column(name = "units_ordered", nullable = false)
    private Long unitsOrdered;

    /**
     * Amount prepaid at the unit price current when the retailer joined.
     */
    @Column(name = "amount_paid", nullable = false)
    private Long amountPaid;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;
}

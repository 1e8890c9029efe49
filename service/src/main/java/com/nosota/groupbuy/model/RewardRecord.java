package com.nosota.groupbuy.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Reward owed to a retailer for a settled order.
 *
 * <p>Created once when the order is settled and flipped exactly once from unclaimed to
 * claimed. Never deleted.
 */
@Entity
@Table(name = "reward_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_reward_order_retailer",
                columnNames = {"order_id", "retailer_id"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RewardRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "retailer_id", nullable = false)
    private String retailerId;

    /**
     * floor(rewardPool * unitsOrdered / totalUnitsInOrder), in reward-asset units.
     */
    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "claimed", nullable = false)
    private boolean claimed;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;
}

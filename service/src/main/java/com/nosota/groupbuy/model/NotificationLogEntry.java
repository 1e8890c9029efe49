package com.nosota.groupbuy.model;

import com.nosota.groupbuy.api.model.NotificationType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Persisted copy of an emitted ledger notification.
 *
 * <p>Written in the transaction of the operation that emitted it, so a rolled back
 * operation leaves no notification behind.
 */
@Entity
@Table(name = "notification_log",
        indexes = @Index(name = "idx_notification_order", columnList = "order_id"))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class NotificationLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 40)
    private NotificationType type;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "participant_id")
    private String participantId;

    @Column(name = "amount")
    private Long amount;

    @Column(name = "payload", nullable = false, length = 4000)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}

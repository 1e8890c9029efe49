package com.nosota.groupbuy.model;

import com.nosota.groupbuy.api.model.Asset;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Balance of one account in one asset, kept by the in-process value-transfer adapter.
 *
 * <p>Balances are never negative: a transfer that would overdraw the source is refused.
 */
@Entity
@Table(name = "token_account",
        uniqueConstraints = @UniqueConstraint(name = "uk_token_account_asset_account",
                columnNames = {"asset", "account_id"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TokenAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset", nullable = false, length = 16)
    private Asset asset;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "balance", nullable = false)
    private Long balance;
}

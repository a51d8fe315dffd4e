package uk.gegc.xpeconomy.features.store.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ownership record. One row per (account, feature); bundle grants write one row per granted feature,
 * all pointing at the same ledger entry. Catalog prices are positive, so every row has a spend behind it.
 */
@Entity
@Table(name = "feature_purchases",
        uniqueConstraints = @UniqueConstraint(name = "uk_feature_purchase_account_feature",
                columnNames = {"account_id", "feature_id"}),
        indexes = @Index(name = "idx_feature_purchase_account", columnList = "account_id"))
@Getter
@Setter
public class FeaturePurchase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "feature_id", nullable = false, updatable = false, length = 100)
    private String featureId;

    @Column(name = "cost_paid", nullable = false, updatable = false)
    private long costPaid;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "bundle_id", updatable = false, length = 100)
    private String bundleId;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private LocalDateTime purchasedAt;
}

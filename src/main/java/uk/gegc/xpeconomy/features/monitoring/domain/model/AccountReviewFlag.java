package uk.gegc.xpeconomy.features.monitoring.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A monitoring finding that needs a human to look at the account. Stays open until resolved.
 */
@Entity
@Table(name = "account_review_flags", indexes = {
        @Index(name = "idx_review_flag_account", columnList = "account_id, resolved"),
        @Index(name = "idx_review_flag_open", columnList = "resolved, created_at")
})
@Getter
@Setter
public class AccountReviewFlag {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "flag_type", nullable = false, updatable = false, length = 30)
    private ReviewFlagType flagType;

    @Column(name = "observed_value", nullable = false, updatable = false)
    private long observedValue;

    @Column(name = "expected_value", nullable = false, updatable = false)
    private long expectedValue;

    @Column(name = "details", length = 1000, updatable = false)
    private String details;

    @Column(name = "spending_frozen", nullable = false, updatable = false)
    private boolean spendingFrozen;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

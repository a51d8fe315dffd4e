package uk.gegc.xpeconomy.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One append-only ledger entry. {@code amount} is signed: positive for EARN, negative for SPEND,
 * so the sum over an account equals its spendable balance.
 */
@Entity
@Immutable
@Table(name = "xp_transactions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_xp_tx_account_sequence", columnNames = {"account_id", "sequence_no"})
}, indexes = {
        @Index(name = "idx_xp_tx_account_created", columnList = "account_id, created_at"),
        @Index(name = "idx_xp_tx_source_created", columnList = "source, created_at")
})
@Getter
@Setter
public class XpTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 16)
    private XpTransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private XpTransactionSource source;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "description", length = 255, updatable = false)
    private String description;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "accumulated_after", nullable = false, updatable = false)
    private long accumulatedAfter;

    @Column(name = "quiz_attempt_id", updatable = false)
    private UUID quizAttemptId;

    @Column(name = "comment_ref", length = 100, updatable = false)
    private String commentRef;

    @Column(name = "feature_ref", length = 100, updatable = false)
    private String featureRef;

    @Column(name = "idempotency_key", unique = true, length = 255, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public long magnitude() {
        return Math.abs(amount);
    }
}

package uk.gegc.xpeconomy.features.account.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A reader's XP wallet. Both balances are only ever changed by the ledger
 * while this row is held under a write lock.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
public class Account {

    public static final int DEFAULT_CURRENT_WPM = 200;
    public static final int DEFAULT_MAX_WPM = 225;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "username", nullable = false, unique = true, length = 100)
    private String username;

    @Column(name = "accumulated_xp", nullable = false)
    private long accumulatedXp;

    @Column(name = "spendable_xp", nullable = false)
    private long spendableXp;

    @Column(name = "current_wpm", nullable = false)
    private int currentWpm = DEFAULT_CURRENT_WPM;

    @Column(name = "max_wpm", nullable = false)
    private int maxWpm = DEFAULT_MAX_WPM;

    /**
     * Number of ledger entries written for this account; the next entry takes {@code ledgerSequence + 1}.
     */
    @Column(name = "ledger_sequence", nullable = false)
    private long ledgerSequence;

    /**
     * Consecutive calendar days on which a quiz earned XP, counted up to {@link #lastXpEarned}.
     */
    @Column(name = "xp_earning_streak", nullable = false)
    private int xpEarningStreak;

    @Column(name = "last_xp_earned")
    private LocalDateTime lastXpEarned;

    @Column(name = "last_successful_wpm")
    private Integer lastSuccessfulWpm;

    @Column(name = "consecutive_failed_attempts", nullable = false)
    private int consecutiveFailedAttempts;

    @Column(name = "spending_frozen", nullable = false)
    private boolean spendingFrozen;

    @Column(name = "frozen_reason", length = 500)
    private String frozenReason;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

package uk.gegc.xpeconomy.features.social.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Authorization record for one comment or reply. Comment text lives in the comment subsystem.
 */
@Entity
@Table(name = "comment_charges", indexes = {
        @Index(name = "idx_comment_charge_account", columnList = "account_id, created_at")
})
@Getter
@Setter
public class CommentCharge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "content_id", nullable = false, updatable = false, length = 100)
    private String contentId;

    @Column(name = "comment_ref", length = 100, updatable = false)
    private String commentRef;

    @Column(name = "reply", nullable = false, updatable = false)
    private boolean reply;

    @Column(name = "xp_charged", nullable = false, updatable = false)
    private long xpCharged;

    @Column(name = "free_credit_used", nullable = false, updatable = false)
    private boolean freeCreditUsed;

    @Column(name = "credit_attempt_id", updatable = false)
    private UUID creditAttemptId;

    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Column(name = "request_id", nullable = false, unique = true, length = 200, updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

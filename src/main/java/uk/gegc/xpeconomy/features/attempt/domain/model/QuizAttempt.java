package uk.gegc.xpeconomy.features.attempt.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "quiz_attempts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_quiz_attempt_number", columnNames = {"account_id", "content_id", "attempt_number"})
}, indexes = {
        @Index(name = "idx_quiz_attempt_account_content", columnList = "account_id, content_id")
})
@Getter
@Setter
public class QuizAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "content_id", nullable = false, updatable = false, length = 100)
    private String contentId;

    /**
     * 1-based position among this account's attempts on this content.
     */
    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Column(name = "score_pct", nullable = false, updatable = false)
    private int scorePct;

    @Column(name = "wpm_used", nullable = false, updatable = false)
    private int wpmUsed;

    @Column(name = "xp_awarded", nullable = false, updatable = false)
    private long xpAwarded;

    @Column(name = "passed", nullable = false, updatable = false)
    private boolean passed;

    @Column(name = "perfect", nullable = false, updatable = false)
    private boolean perfect;

    /**
     * Set for perfect attempts until a comment on the content consumes it.
     */
    @Column(name = "free_comment_credit", nullable = false)
    private boolean freeCommentCredit;

    @Column(name = "request_id", unique = true, length = 200, updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}

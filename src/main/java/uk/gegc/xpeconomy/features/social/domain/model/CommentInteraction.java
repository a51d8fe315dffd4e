package uk.gegc.xpeconomy.features.social.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One reaction on a comment. Written together with the actor's spend; the author's reward
 * is linked afterwards in a separate transaction.
 */
@Entity
@Table(name = "comment_interactions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_interaction_actor_comment_tier", columnNames = {"actor_id", "comment_ref", "tier"})
}, indexes = {
        @Index(name = "idx_interaction_author", columnList = "author_id")
})
@Getter
@Setter
public class CommentInteraction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Column(name = "author_id", nullable = false, updatable = false)
    private UUID authorId;

    @Column(name = "comment_ref", nullable = false, updatable = false, length = 100)
    private String commentRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, updatable = false, length = 20)
    private InteractionTier tier;

    @Column(name = "xp_cost", nullable = false, updatable = false)
    private long xpCost;

    @Column(name = "author_reward", nullable = false, updatable = false)
    private long authorReward;

    @Column(name = "spend_transaction_id", updatable = false)
    private UUID spendTransactionId;

    @Column(name = "reward_transaction_id")
    private UUID rewardTransactionId;

    @Column(name = "request_id", nullable = false, unique = true, length = 200, updatable = false)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean rewardPending() {
        return authorReward > 0 && rewardTransactionId == null;
    }
}

package uk.gegc.xpeconomy.features.social.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import uk.gegc.xpeconomy.features.social.domain.model.CommentInteraction;
import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CommentInteractionRepository extends JpaRepository<CommentInteraction, UUID> {

    Optional<CommentInteraction> findByRequestId(String requestId);

    boolean existsByActorIdAndCommentRefAndTier(UUID actorId, String commentRef, InteractionTier tier);

    long countByActorIdAndTierIn(UUID actorId, Collection<InteractionTier> tiers);

    long countByAuthorIdAndTierIn(UUID authorId, Collection<InteractionTier> tiers);

    @Query("select i from CommentInteraction i where i.authorReward > 0 and i.rewardTransactionId is null")
    List<CommentInteraction> findPendingRewards();

    List<CommentInteraction> findByCommentRef(String commentRef);
}

package uk.gegc.xpeconomy.features.social.application;

import uk.gegc.xpeconomy.features.social.api.dto.*;
import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.util.UUID;

public interface SocialInteractionService {

    /**
     * Authorizes and charges a new comment or reply. A perfect-score credit on the content is used
     * before any XP is spent.
     *
     * @throws uk.gegc.xpeconomy.features.social.domain.exception.CommentNotUnlockedException without a passed attempt
     * @throws uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException when the balance is short
     */
    CommentChargeDto authorizeComment(UUID accountId, String contentId, String commentRef, boolean reply,
                                      String requestId);

    CommentQuoteDto quoteComment(UUID accountId, String contentId, boolean reply);

    /**
     * Charges the actor, then rewards the author in a second transaction. Safe to repeat with the same
     * request id after a partial failure: the actor is charged once and the author rewarded once.
     */
    CommentInteractionDto interact(UUID actorId, UUID authorId, String commentRef, InteractionTier tier,
                                   String requestId);

    /**
     * Finishes author rewards whose second step never ran.
     *
     * @return how many rewards were completed
     */
    int completePendingRewards();

    SocialCostsDto getCosts();

    SocialSummaryDto getSummary(UUID accountId);
}

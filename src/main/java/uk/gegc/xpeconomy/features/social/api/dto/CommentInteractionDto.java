package uk.gegc.xpeconomy.features.social.api.dto;

import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.time.LocalDateTime;
import java.util.UUID;

public record CommentInteractionDto(
        UUID id,
        UUID actorId,
        UUID authorId,
        String commentRef,
        InteractionTier tier,
        long xpCost,
        long authorReward,
        UUID spendTransactionId,
        UUID rewardTransactionId,
        String requestId,
        LocalDateTime createdAt
) {}

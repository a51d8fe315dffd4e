package uk.gegc.xpeconomy.features.social.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record CommentChargeDto(
        UUID id,
        UUID accountId,
        String contentId,
        String commentRef,
        boolean reply,
        long xpCharged,
        boolean freeCreditUsed,
        UUID creditAttemptId,
        UUID transactionId,
        String requestId,
        LocalDateTime createdAt
) {}

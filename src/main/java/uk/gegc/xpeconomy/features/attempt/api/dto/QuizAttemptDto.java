package uk.gegc.xpeconomy.features.attempt.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record QuizAttemptDto(
        UUID id,
        UUID accountId,
        String contentId,
        int attemptNumber,
        int scorePct,
        int wpmUsed,
        long xpAwarded,
        boolean passed,
        boolean perfect,
        boolean freeCommentCredit,
        String requestId,
        LocalDateTime createdAt
) {}

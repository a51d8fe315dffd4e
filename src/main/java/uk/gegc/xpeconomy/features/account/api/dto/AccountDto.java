package uk.gegc.xpeconomy.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "AccountDto", description = "XP account with both balances and reading speed")
public record AccountDto(
        @Schema(description = "Account UUID")
        UUID id,

        @Schema(description = "External identity the account belongs to", example = "reader42")
        String username,

        @Schema(description = "Lifetime XP earned, never decreases", example = "1520")
        long accumulatedXp,

        @Schema(description = "XP currently available to spend", example = "340")
        long spendableXp,

        @Schema(description = "Reading speed the reader currently uses", example = "200")
        int currentWpm,

        @Schema(description = "Highest reading speed unlocked", example = "225")
        int maxWpm,

        @Schema(description = "Consecutive days with XP earned from quizzes", example = "4")
        int xpEarningStreak,

        LocalDateTime lastXpEarned,

        @Schema(description = "Whether spending is frozen pending review")
        boolean spendingFrozen,

        String frozenReason,

        LocalDateTime createdAt
) {}

package uk.gegc.xpeconomy.features.progression.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "ReadingSpeedDto", description = "Reading speed settings and the next unlock")
public record ReadingSpeedDto(
        UUID accountId,

        @Schema(example = "200")
        int currentWpm,

        @Schema(example = "225")
        int maxWpm,

        @Schema(description = "Max speed after the next unlock", example = "250")
        int nextMaxWpm,

        @Schema(description = "XP credited on the next unlock", example = "50")
        long unlockBonusXp,

        @Schema(description = "Suggested speed for the next attempt, lowered after failed quizzes", example = "175")
        int recommendedWpm,

        @Schema(description = "Failed quizzes since the last pass", example = "1")
        int consecutiveFailedAttempts
) {}

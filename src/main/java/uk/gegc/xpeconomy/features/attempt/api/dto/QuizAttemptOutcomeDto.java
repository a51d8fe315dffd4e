package uk.gegc.xpeconomy.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.progression.application.ProgressionOutcome;
import uk.gegc.xpeconomy.features.progression.application.StreakOutcome;
import uk.gegc.xpeconomy.features.reward.api.dto.RewardResultDto;

@Schema(name = "QuizAttemptOutcomeDto", description = "Recorded attempt with its reward and any speed unlock")
public record QuizAttemptOutcomeDto(
        QuizAttemptDto attempt,

        @Schema(description = "Reward breakdown; absent when the request was a replay")
        RewardResultDto reward,

        @Schema(description = "Speed unlock triggered by this attempt, if any")
        ProgressionOutcome progression,

        @Schema(description = "Reading streak update when this attempt was the first to earn XP today")
        StreakOutcome streak,

        @Schema(description = "Suggested speed for the next try; only present when the attempt failed", example = "175")
        Integer recommendedWpm,

        BalanceDto balance,

        @Schema(description = "True when the request id had already been processed")
        boolean replayed
) {}

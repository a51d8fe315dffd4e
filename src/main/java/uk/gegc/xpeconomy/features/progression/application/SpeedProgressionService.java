package uk.gegc.xpeconomy.features.progression.application;

import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.progression.api.dto.ReadingSpeedDto;

import java.util.Optional;
import java.util.UUID;

public interface SpeedProgressionService {

    ReadingSpeedDto getReadingSpeed(UUID accountId);

    /**
     * Free change of the working speed, anywhere in {@code (0, maxWpm]}.
     */
    ReadingSpeedDto setCurrentWpm(UUID accountId, int currentWpm);

    /**
     * Unlocks the next speed when a fresh attempt was perfect at the current maximum.
     * Must be called inside the transaction that recorded the attempt, with {@code account} locked.
     *
     * @return the unlock, or empty when the attempt does not qualify
     */
    Optional<ProgressionOutcome> applyProgression(Account account, UUID quizAttemptId, int attemptNumber,
                                                  int wpmUsed, int scorePct, String requestId);

    /**
     * Remembers the speed of a passed quiz, or counts one more failure since the last pass.
     * Same transaction rules as {@link #applyProgression}.
     */
    void recordAttemptSpeed(Account account, int wpmUsed, boolean passed);

    /**
     * Speed to suggest for the next attempt: the last passing speed (or the starting speed), lowered by
     * {@code recommendationStep} per failure since then, never by more than {@code maxRecommendationReduction}
     * and never below {@code minRecommendedWpm}.
     */
    int recommendedWpm(Account account);
}

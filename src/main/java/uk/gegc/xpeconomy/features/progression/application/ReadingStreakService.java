package uk.gegc.xpeconomy.features.progression.application;

import uk.gegc.xpeconomy.features.account.domain.model.Account;

import java.util.Optional;
import java.util.UUID;

public interface ReadingStreakService {

    /**
     * Counts today as an earning day for {@code account}: the streak grows on the day after the last
     * earning day and restarts at 1 after a gap. Only the first earning attempt of a day moves the streak
     * or pays a bonus. Must be called inside the transaction that recorded the attempt, with
     * {@code account} locked.
     *
     * @return the updated streak, or empty when today was already counted
     */
    Optional<StreakOutcome> recordEarningDay(Account account, UUID quizAttemptId, String requestId);

    /**
     * Bonus for a streak of {@code streakDays}: 5, 10, 25 and 50 XP from 3, 7, 14 and 30 days.
     */
    long bonusFor(int streakDays);
}

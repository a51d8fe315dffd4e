package uk.gegc.xpeconomy.features.progression.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.progression.application.ReadingStreakService;
import uk.gegc.xpeconomy.features.progression.application.StreakOutcome;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingStreakServiceImpl implements ReadingStreakService {

    private static final NavigableMap<Integer, Long> BONUS_BY_STREAK_DAYS = new TreeMap<>(Map.of(
            3, 5L,
            7, 10L,
            14, 25L,
            30, 50L
    ));

    private final AccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final Clock clock;

    @Override
    public Optional<StreakOutcome> recordEarningDay(Account account, UUID quizAttemptId, String requestId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        LocalDateTime lastEarned = account.getLastXpEarned();
        if (lastEarned != null && !lastEarned.toLocalDate().isBefore(today)) {
            return Optional.empty();
        }

        boolean consecutive = lastEarned != null && lastEarned.toLocalDate().plusDays(1).equals(today);
        int streak = consecutive ? account.getXpEarningStreak() + 1 : 1;
        account.setXpEarningStreak(streak);
        account.setLastXpEarned(now);
        accountRepository.save(account);

        long bonus = bonusFor(streak);
        UUID bonusTransactionId = null;
        if (bonus > 0) {
            bonusTransactionId = ledgerService.earn(
                    account.getId(),
                    bonus,
                    XpTransactionSource.READING_STREAK,
                    streak + "-day reading streak",
                    TransactionRefs.request(requestId != null ? requestId + ":streak" : null)
                            .withQuizAttempt(quizAttemptId)
            ).id();
        }

        log.info("Account {} reading streak {} day(s){}", account.getId(), streak,
                bonus > 0 ? ", bonus " + bonus + " XP" : "");
        return Optional.of(new StreakOutcome(streak, bonus, bonusTransactionId));
    }

    @Override
    public long bonusFor(int streakDays) {
        Map.Entry<Integer, Long> tier = BONUS_BY_STREAK_DAYS.floorEntry(streakDays);
        return tier != null ? tier.getValue() : 0L;
    }
}

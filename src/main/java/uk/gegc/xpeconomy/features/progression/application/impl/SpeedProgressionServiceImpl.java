package uk.gegc.xpeconomy.features.progression.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.progression.api.dto.ReadingSpeedDto;
import uk.gegc.xpeconomy.features.progression.application.ProgressionOutcome;
import uk.gegc.xpeconomy.features.progression.application.ProgressionProperties;
import uk.gegc.xpeconomy.features.progression.application.SpeedProgressionService;
import uk.gegc.xpeconomy.features.reward.application.XpCalculationEngine;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpeedProgressionServiceImpl implements SpeedProgressionService {

    private final AccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final XpMutationExecutor mutationExecutor;
    private final ProgressionProperties progressionProperties;

    @Override
    @Transactional(readOnly = true)
    public ReadingSpeedDto getReadingSpeed(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
        return toDto(account);
    }

    @Override
    public ReadingSpeedDto setCurrentWpm(UUID accountId, int currentWpm) {
        if (currentWpm <= 0) {
            throw new XpValidationException("currentWpm must be > 0");
        }
        return mutationExecutor.execute(accountId, "set-wpm", () -> {
            Account account = accountRepository.findByIdForUpdate(accountId)
                    .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
            if (currentWpm > account.getMaxWpm()) {
                throw new XpValidationException("currentWpm " + currentWpm
                        + " exceeds the unlocked maximum of " + account.getMaxWpm());
            }
            account.setCurrentWpm(currentWpm);
            accountRepository.save(account);
            log.debug("Account {} reading speed set to {} wpm", accountId, currentWpm);
            return toDto(account);
        });
    }

    @Override
    public Optional<ProgressionOutcome> applyProgression(Account account, UUID quizAttemptId, int attemptNumber,
                                                         int wpmUsed, int scorePct, String requestId) {
        boolean qualifies = attemptNumber == 1
                && wpmUsed == account.getMaxWpm()
                && scorePct == XpCalculationEngine.PERFECT_SCORE;
        if (!qualifies) {
            return Optional.empty();
        }

        int previousMax = account.getMaxWpm();
        int newMax = previousMax + progressionProperties.getWpmStep();
        account.setMaxWpm(newMax);
        accountRepository.save(account);

        String bonusKey = requestId != null ? requestId + ":progression" : null;
        XpTransactionDto bonus = ledgerService.earn(
                account.getId(),
                progressionProperties.getBonusXp(),
                XpTransactionSource.SPEED_PROGRESSION,
                "Reading speed unlocked: " + previousMax + " -> " + newMax + " wpm",
                TransactionRefs.request(bonusKey).withQuizAttempt(quizAttemptId)
        );

        log.info("Account {} unlocked {} wpm (was {}), bonus {} XP", account.getId(), newMax, previousMax,
                progressionProperties.getBonusXp());
        return Optional.of(new ProgressionOutcome(previousMax, newMax, progressionProperties.getBonusXp(), bonus.id()));
    }

    @Override
    public void recordAttemptSpeed(Account account, int wpmUsed, boolean passed) {
        if (passed) {
            account.setLastSuccessfulWpm(wpmUsed);
            account.setConsecutiveFailedAttempts(0);
        } else {
            account.setConsecutiveFailedAttempts(account.getConsecutiveFailedAttempts() + 1);
        }
        accountRepository.save(account);
    }

    @Override
    public int recommendedWpm(Account account) {
        int base = account.getLastSuccessfulWpm() != null
                ? account.getLastSuccessfulWpm()
                : progressionProperties.getInitialCurrentWpm();
        int reduction = Math.min(
                account.getConsecutiveFailedAttempts() * progressionProperties.getRecommendationStep(),
                progressionProperties.getMaxRecommendationReduction());
        return Math.max(base - reduction, progressionProperties.getMinRecommendedWpm());
    }

    private ReadingSpeedDto toDto(Account account) {
        return new ReadingSpeedDto(
                account.getId(),
                account.getCurrentWpm(),
                account.getMaxWpm(),
                account.getMaxWpm() + progressionProperties.getWpmStep(),
                progressionProperties.getBonusXp(),
                recommendedWpm(account),
                account.getConsecutiveFailedAttempts()
        );
    }
}

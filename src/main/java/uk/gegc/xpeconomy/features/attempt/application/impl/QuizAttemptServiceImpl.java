package uk.gegc.xpeconomy.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptDto;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptOutcomeDto;
import uk.gegc.xpeconomy.features.attempt.application.QuizAttemptProperties;
import uk.gegc.xpeconomy.features.attempt.application.QuizAttemptService;
import uk.gegc.xpeconomy.features.attempt.application.QuizGrade;
import uk.gegc.xpeconomy.features.attempt.domain.exception.GradingFailedException;
import uk.gegc.xpeconomy.features.attempt.domain.exception.GradingTimeoutException;
import uk.gegc.xpeconomy.features.attempt.domain.model.QuizAttempt;
import uk.gegc.xpeconomy.features.attempt.infra.mapping.QuizAttemptMapper;
import uk.gegc.xpeconomy.features.attempt.infra.repository.QuizAttemptRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.exception.IdempotencyConflictException;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.progression.application.ProgressionOutcome;
import uk.gegc.xpeconomy.features.progression.application.ReadingStreakService;
import uk.gegc.xpeconomy.features.progression.application.SpeedProgressionService;
import uk.gegc.xpeconomy.features.progression.application.StreakOutcome;
import uk.gegc.xpeconomy.features.reward.application.ContentInputs;
import uk.gegc.xpeconomy.features.reward.application.ContentMetricsService;
import uk.gegc.xpeconomy.features.reward.application.XpCalculationEngine;
import uk.gegc.xpeconomy.features.reward.domain.model.RewardResult;
import uk.gegc.xpeconomy.features.reward.infra.mapping.RewardMapper;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuizAttemptServiceImpl implements QuizAttemptService {

    private final AccountRepository accountRepository;
    private final QuizAttemptRepository attemptRepository;
    private final QuizAttemptMapper attemptMapper;
    private final ContentMetricsService contentMetricsService;
    private final XpCalculationEngine calculationEngine;
    private final RewardMapper rewardMapper;
    private final LedgerService ledgerService;
    private final SpeedProgressionService progressionService;
    private final ReadingStreakService streakService;
    private final XpMutationExecutor mutationExecutor;
    private final QuizAttemptProperties quizAttemptProperties;
    private final Clock clock;

    @Override
    public QuizAttemptOutcomeDto recordQuizAttempt(UUID accountId, String contentId, int scorePct, int wpmUsed,
                                                   String requestId) {
        if (contentId == null || contentId.isBlank()) {
            throw new XpValidationException("contentId must not be blank");
        }
        if (scorePct < 0 || scorePct > XpCalculationEngine.PERFECT_SCORE) {
            throw new XpValidationException("scorePct must be between 0 and 100");
        }
        if (wpmUsed <= 0) {
            throw new XpValidationException("wpmUsed must be > 0");
        }
        String key = requestId != null && !requestId.isBlank() ? requestId : null;
        ContentInputs inputs = contentMetricsService.resolveInputs(contentId);

        return mutationExecutor.execute(accountId, "quiz-attempt",
                () -> doRecord(accountId, inputs, scorePct, wpmUsed, key));
    }

    @Override
    public QuizAttemptOutcomeDto recordGradedAttempt(UUID accountId, String contentId,
                                                     CompletableFuture<QuizGrade> grade, String requestId) {
        long timeoutMillis = quizAttemptProperties.getGradingTimeout().toMillis();
        QuizGrade result;
        try {
            result = grade.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            grade.cancel(true);
            log.warn("Grading for account {} on content {} did not finish within {} ms", accountId, contentId, timeoutMillis);
            throw new GradingTimeoutException("Quiz grading did not complete within " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            grade.cancel(true);
            throw new GradingTimeoutException("Interrupted while waiting for quiz grading", e);
        } catch (ExecutionException e) {
            throw new GradingFailedException("Quiz grading failed: " + e.getCause().getMessage(), e.getCause());
        }
        return recordQuizAttempt(accountId, contentId, result.scorePct(), result.wpmUsed(), requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuizAttemptDto> listAttempts(UUID accountId, String contentId) {
        if (!accountRepository.existsById(accountId)) {
            throw new ResourceNotFoundException("Account " + accountId + " not found");
        }
        List<QuizAttempt> attempts = contentId != null
                ? attemptRepository.findByAccountIdAndContentIdOrderByAttemptNumberAsc(accountId, contentId)
                : attemptRepository.findTop50ByAccountIdOrderByCreatedAtDesc(accountId);
        return attemptMapper.toDtos(attempts);
    }

    private QuizAttemptOutcomeDto doRecord(UUID accountId, ContentInputs inputs, int scorePct, int wpmUsed,
                                           String requestId) {
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));

        if (requestId != null) {
            Optional<QuizAttempt> existing = attemptRepository.findByRequestId(requestId);
            if (existing.isPresent()) {
                return replay(existing.get(), account, inputs.contentId());
            }
        }

        if (wpmUsed > account.getMaxWpm()) {
            throw new XpValidationException("wpmUsed " + wpmUsed + " exceeds the unlocked maximum of "
                    + account.getMaxWpm());
        }

        int attemptNumber = attemptRepository.countByAccountIdAndContentId(accountId, inputs.contentId()) + 1;
        RewardResult reward = calculationEngine.calculate(
                inputs.lengthMetric(), inputs.readingLevel(), scorePct, wpmUsed, attemptNumber);

        QuizAttempt attempt = new QuizAttempt();
        attempt.setAccountId(accountId);
        attempt.setContentId(inputs.contentId());
        attempt.setAttemptNumber(attemptNumber);
        attempt.setScorePct(scorePct);
        attempt.setWpmUsed(wpmUsed);
        attempt.setXpAwarded(reward.xpAwarded());
        attempt.setPassed(reward.passed());
        attempt.setPerfect(reward.perfect());
        attempt.setFreeCommentCredit(reward.perfect());
        attempt.setRequestId(requestId);
        attempt.setCreatedAt(LocalDateTime.now(clock));
        attempt = attemptRepository.saveAndFlush(attempt);

        if (reward.xpAwarded() > 0) {
            ledgerService.earn(
                    accountId,
                    reward.xpAwarded(),
                    XpTransactionSource.QUIZ_COMPLETION,
                    "Quiz on " + inputs.contentId() + ", attempt " + attemptNumber + ", score " + scorePct + "%",
                    TransactionRefs.request(requestId != null ? requestId + ":reward" : null)
                            .withQuizAttempt(attempt.getId())
            );
        }

        progressionService.recordAttemptSpeed(account, wpmUsed, reward.passed());
        ProgressionOutcome progression = progressionService
                .applyProgression(account, attempt.getId(), attemptNumber, wpmUsed, scorePct, requestId)
                .orElse(null);
        StreakOutcome streak = reward.xpAwarded() > 0
                ? streakService.recordEarningDay(account, attempt.getId(), requestId).orElse(null)
                : null;
        Integer recommendedWpm = reward.passed() ? null : progressionService.recommendedWpm(account);

        log.info("Recorded attempt {} for account {} on {}: score={}, wpm={}, xp={}, progression={}, streak={}",
                attemptNumber, accountId, inputs.contentId(), scorePct, wpmUsed, reward.xpAwarded(),
                progression != null, streak != null ? streak.streakDays() : null);

        return new QuizAttemptOutcomeDto(
                attemptMapper.toDto(attempt),
                rewardMapper.toDto(reward),
                progression,
                streak,
                recommendedWpm,
                balanceOf(account),
                false
        );
    }

    private QuizAttemptOutcomeDto replay(QuizAttempt existing, Account account, String contentId) {
        if (!existing.getAccountId().equals(account.getId()) || !existing.getContentId().equals(contentId)) {
            throw new IdempotencyConflictException(
                    "Request id " + existing.getRequestId() + " was already used for a different quiz attempt");
        }
        log.info("Quiz attempt request {} already recorded as attempt {}", existing.getRequestId(), existing.getId());
        return new QuizAttemptOutcomeDto(attemptMapper.toDto(existing), null, null, null, null, balanceOf(account),
                true);
    }

    private static BalanceDto balanceOf(Account account) {
        return new BalanceDto(account.getId(), account.getAccumulatedXp(), account.getSpendableXp());
    }
}

package uk.gegc.xpeconomy.features.attempt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import uk.gegc.xpeconomy.BaseIntegrationTest;
import uk.gegc.xpeconomy.features.account.application.AccountService;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptOutcomeDto;
import uk.gegc.xpeconomy.features.attempt.application.QuizAttemptService;
import uk.gegc.xpeconomy.features.attempt.application.QuizGrade;
import uk.gegc.xpeconomy.features.attempt.domain.exception.GradingFailedException;
import uk.gegc.xpeconomy.features.attempt.domain.exception.GradingTimeoutException;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.DerivedBalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.progression.api.dto.ReadingSpeedDto;
import uk.gegc.xpeconomy.features.progression.application.SpeedProgressionService;
import uk.gegc.xpeconomy.features.reward.api.dto.UpsertContentMetricsRequest;
import uk.gegc.xpeconomy.features.reward.application.ContentMetricsService;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Quiz attempts: reward, diminishing returns and speed unlocks")
class QuizRewardIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private ContentMetricsService contentMetricsService;

    @Autowired
    private QuizAttemptService quizAttemptService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private SpeedProgressionService progressionService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private Clock clock;

    private UUID accountId;
    private String contentId;

    @BeforeEach
    void setUp() {
        accountId = accountService.registerAccount("reader-" + UUID.randomUUID()).id();
        contentId = "book-" + UUID.randomUUID();
        contentMetricsService.upsert(contentId, new UpsertContentMetricsRequest(1000, 4500, new BigDecimal("8.0")));
    }

    @Test
    @DisplayName("perfect first attempt at max speed earns the reward and unlocks the next speed")
    void perfectAttemptAtMaxSpeedUnlocksProgression() {
        QuizAttemptOutcomeDto outcome = quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 225, "q-" + UUID.randomUUID());

        assertThat(outcome.replayed()).isFalse();
        assertThat(outcome.reward().xpAwarded()).isEqualTo(900);
        assertThat(outcome.attempt().freeCommentCredit()).isTrue();
        assertThat(outcome.progression()).isNotNull();
        assertThat(outcome.progression().previousMaxWpm()).isEqualTo(225);
        assertThat(outcome.progression().newMaxWpm()).isEqualTo(250);
        assertThat(outcome.progression().bonusXp()).isEqualTo(50);
        assertThat(outcome.balance().accumulatedXp()).isEqualTo(950);

        ReadingSpeedDto speed = progressionService.getReadingSpeed(accountId);
        assertThat(speed.maxWpm()).isEqualTo(250);
        assertThat(speed.currentWpm()).isEqualTo(200);
    }

    @Test
    @DisplayName("a retry earns half and never unlocks a speed")
    void retryIsHalvedWithoutProgression() {
        quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 225, "q-" + UUID.randomUUID());

        QuizAttemptOutcomeDto second = quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 200, "q-" + UUID.randomUUID());

        assertThat(second.attempt().attemptNumber()).isEqualTo(2);
        assertThat(second.reward().xpAwarded()).isEqualTo(400);
        assertThat(second.progression()).isNull();
        assertThat(ledgerService.getBalance(accountId).accumulatedXp()).isEqualTo(1350);
    }

    @Test
    @DisplayName("replaying a request id returns the recorded attempt without paying again")
    void replayDoesNotPayTwice() {
        String requestId = "q-" + UUID.randomUUID();
        QuizAttemptOutcomeDto first = quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 225, requestId);

        QuizAttemptOutcomeDto replay = quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 225, requestId);

        assertThat(replay.replayed()).isTrue();
        assertThat(replay.reward()).isNull();
        assertThat(replay.attempt().id()).isEqualTo(first.attempt().id());
        BalanceDto balance = ledgerService.getBalance(accountId);
        assertThat(balance.accumulatedXp()).isEqualTo(950);
        assertThat(balance.spendableXp()).isEqualTo(950);
        assertThat(progressionService.getReadingSpeed(accountId).maxWpm()).isEqualTo(250);
    }

    @Test
    @DisplayName("a perfect score below max speed earns but does not unlock")
    void perfectBelowMaxDoesNotUnlock() {
        QuizAttemptOutcomeDto outcome = quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 200, null);

        assertThat(outcome.reward().xpAwarded()).isEqualTo(800);
        assertThat(outcome.progression()).isNull();
        assertThat(progressionService.getReadingSpeed(accountId).maxWpm()).isEqualTo(225);
    }

    @Test
    @DisplayName("a failing score is recorded with zero XP")
    void failingScore() {
        QuizAttemptOutcomeDto outcome = quizAttemptService.recordQuizAttempt(accountId, contentId, 59, 200, null);

        assertThat(outcome.attempt().passed()).isFalse();
        assertThat(outcome.reward().xpAwarded()).isZero();
        assertThat(outcome.streak()).isNull();
        assertThat(outcome.recommendedWpm()).isEqualTo(175);
        assertThat(ledgerService.getBalance(accountId).accumulatedXp()).isZero();
    }

    @Test
    @DisplayName("repeated failures lower the recommended speed until the next pass")
    void recommendedSpeedAfterFailures() {
        quizAttemptService.recordQuizAttempt(accountId, contentId, 40, 200, null);
        QuizAttemptOutcomeDto second = quizAttemptService.recordQuizAttempt(accountId, contentId, 50, 200, null);

        assertThat(second.recommendedWpm()).isEqualTo(150);
        ReadingSpeedDto speed = progressionService.getReadingSpeed(accountId);
        assertThat(speed.recommendedWpm()).isEqualTo(150);
        assertThat(speed.consecutiveFailedAttempts()).isEqualTo(2);

        QuizAttemptOutcomeDto pass = quizAttemptService.recordQuizAttempt(accountId, contentId, 90, 175, null);

        assertThat(pass.recommendedWpm()).isNull();
        assertThat(progressionService.getReadingSpeed(accountId).recommendedWpm()).isEqualTo(175);
        assertThat(progressionService.getReadingSpeed(accountId).consecutiveFailedAttempts()).isZero();
    }

    @Test
    @DisplayName("the first earning attempt of a day starts a reading streak with no bonus")
    void firstEarningDayStartsStreak() {
        QuizAttemptOutcomeDto first = quizAttemptService.recordQuizAttempt(accountId, contentId, 80, 200, null);
        QuizAttemptOutcomeDto second = quizAttemptService.recordQuizAttempt(accountId, contentId, 80, 200, null);

        assertThat(first.streak().streakDays()).isEqualTo(1);
        assertThat(first.streak().bonusXp()).isZero();
        assertThat(second.streak()).isNull();
        assertThat(accountService.getAccount(accountId).xpEarningStreak()).isEqualTo(1);
    }

    @Test
    @DisplayName("a third consecutive earning day books the streak bonus as its own entry")
    void streakBonusOnThirdDay() {
        Account account = accountRepository.findById(accountId).orElseThrow();
        account.setXpEarningStreak(2);
        account.setLastXpEarned(LocalDateTime.now(clock).minusDays(1));
        accountRepository.save(account);
        String requestId = "q-" + UUID.randomUUID();

        QuizAttemptOutcomeDto outcome = quizAttemptService.recordQuizAttempt(accountId, contentId, 80, 200, requestId);

        assertThat(outcome.reward().xpAwarded()).isEqualTo(512);
        assertThat(outcome.streak().streakDays()).isEqualTo(3);
        assertThat(outcome.streak().bonusXp()).isEqualTo(5);
        assertThat(outcome.balance().accumulatedXp()).isEqualTo(517);

        List<XpTransactionDto> streakEntries = ledgerService
                .listTransactions(accountId, null, XpTransactionSource.READING_STREAK, null, null, PageRequest.of(0, 10))
                .getContent();
        assertThat(streakEntries).singleElement().satisfies(tx -> {
            assertThat(tx.id()).isEqualTo(outcome.streak().bonusTransactionId());
            assertThat(tx.amount()).isEqualTo(5);
            assertThat(tx.idempotencyKey()).isEqualTo(requestId + ":streak");
            assertThat(tx.quizAttemptId()).isEqualTo(outcome.attempt().id());
        });

        QuizAttemptOutcomeDto replay = quizAttemptService.recordQuizAttempt(accountId, contentId, 80, 200, requestId);
        assertThat(replay.replayed()).isTrue();
        assertThat(ledgerService.getBalance(accountId).accumulatedXp()).isEqualTo(517);
    }

    @Test
    @DisplayName("reading faster than the unlocked maximum is rejected")
    void speedAboveMaxRejected() {
        assertThatThrownBy(() -> quizAttemptService.recordQuizAttempt(accountId, contentId, 100, 300, null))
                .isInstanceOf(XpValidationException.class);
        assertThat(quizAttemptService.listAttempts(accountId, contentId)).isEmpty();
    }

    @Test
    @DisplayName("unknown content is reported as not found")
    void unknownContent() {
        assertThatThrownBy(() -> quizAttemptService.recordQuizAttempt(accountId, "missing-" + UUID.randomUUID(), 90, 200, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("a graded future feeds the same recording path")
    void gradedAttempt() {
        QuizAttemptOutcomeDto outcome = quizAttemptService.recordGradedAttempt(accountId, contentId,
                CompletableFuture.completedFuture(new QuizGrade(80, 200)), null);

        assertThat(outcome.reward().xpAwarded()).isEqualTo(512);
    }

    @Test
    @DisplayName("a failed grader leaves nothing behind")
    void failedGrader() {
        CompletableFuture<QuizGrade> grade = CompletableFuture.failedFuture(new IllegalStateException("grader down"));

        assertThatThrownBy(() -> quizAttemptService.recordGradedAttempt(accountId, contentId, grade, null))
                .isInstanceOf(GradingFailedException.class);
        assertThat(quizAttemptService.listAttempts(accountId, contentId)).isEmpty();
    }

    @Test
    @DisplayName("a grader that never answers times out without touching the ledger")
    void gradingTimeout() {
        ledgerService.earn(accountId, 30, XpTransactionSource.ADMIN_ADJUSTMENT, "seed", TransactionRefs.none());
        CompletableFuture<QuizGrade> grade = new CompletableFuture<>();

        assertThatThrownBy(() -> quizAttemptService.recordGradedAttempt(accountId, contentId, grade, "q-" + UUID.randomUUID()))
                .isInstanceOf(GradingTimeoutException.class);

        assertThat(grade.isCancelled()).isTrue();
        assertThat(quizAttemptService.listAttempts(accountId, contentId)).isEmpty();
        DerivedBalanceDto derived = ledgerService.getDerivedBalance(accountId);
        assertThat(derived.entryCount()).isEqualTo(1);
        assertThat(derived.storedAccumulatedXp()).isEqualTo(30);
        assertThat(derived.storedSpendableXp()).isEqualTo(30);
        assertThat(derived.consistent()).isTrue();
    }
}

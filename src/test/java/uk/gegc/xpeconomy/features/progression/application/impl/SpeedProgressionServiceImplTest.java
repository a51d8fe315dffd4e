package uk.gegc.xpeconomy.features.progression.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import uk.gegc.xpeconomy.BaseUnitTest;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;
import uk.gegc.xpeconomy.features.progression.application.ProgressionOutcome;
import uk.gegc.xpeconomy.features.progression.application.ProgressionProperties;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SpeedProgressionServiceImpl unit tests")
class SpeedProgressionServiceImplTest extends BaseUnitTest {

    @Mock private AccountRepository accountRepository;
    @Mock private LedgerService ledgerService;
    @Mock private XpMutationExecutor mutationExecutor;

    private SpeedProgressionServiceImpl service;
    private Account account;
    private final UUID attemptId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new SpeedProgressionServiceImpl(accountRepository, ledgerService, mutationExecutor,
                new ProgressionProperties());
        account = new Account();
        account.setId(UUID.randomUUID());
        account.setCurrentWpm(200);
        account.setMaxWpm(225);
        lenient().when(mutationExecutor.execute(any(), anyString(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(2)).get());
    }

    @Test
    @DisplayName("perfect first attempt at max speed raises max by 25 and pays 50 XP")
    void qualifyingAttemptUnlocks() {
        when(ledgerService.earn(eq(account.getId()), eq(50L), eq(XpTransactionSource.SPEED_PROGRESSION), anyString(),
                eq(TransactionRefs.request("g-1:progression").withQuizAttempt(attemptId))))
                .thenReturn(bonusEntry());

        Optional<ProgressionOutcome> outcome = service.applyProgression(account, attemptId, 1, 225, 100, "g-1");

        assertThat(outcome).get().satisfies(o -> {
            assertThat(o.previousMaxWpm()).isEqualTo(225);
            assertThat(o.newMaxWpm()).isEqualTo(250);
            assertThat(o.bonusXp()).isEqualTo(50);
        });
        assertThat(account.getMaxWpm()).isEqualTo(250);
        assertThat(account.getCurrentWpm()).isEqualTo(200);
        verify(accountRepository).save(account);
    }

    @ParameterizedTest(name = "attempt {0} at {1} wpm scoring {2} does not unlock")
    @CsvSource({
            "2, 225, 100",
            "1, 200, 100",
            "1, 225, 99"
    })
    void nonQualifyingAttempts(int attemptNumber, int wpm, int score) {
        Optional<ProgressionOutcome> outcome = service.applyProgression(account, attemptId, attemptNumber, wpm, score, null);

        assertThat(outcome).isEmpty();
        assertThat(account.getMaxWpm()).isEqualTo(225);
        verifyNoInteractions(ledgerService, accountRepository);
    }

    @Test
    @DisplayName("current speed may move freely below the maximum")
    void setCurrentWpm() {
        when(accountRepository.findByIdForUpdate(account.getId())).thenReturn(Optional.of(account));

        assertThat(service.setCurrentWpm(account.getId(), 150).currentWpm()).isEqualTo(150);
        assertThatThrownBy(() -> service.setCurrentWpm(account.getId(), 226))
                .isInstanceOf(XpValidationException.class);
        assertThat(account.getCurrentWpm()).isEqualTo(150);
    }

    @ParameterizedTest(name = "last pass at {0} wpm, {1} failures -> {2} wpm")
    @CsvSource({
            "225, 0, 225",
            "225, 1, 200",
            "225, 3, 150",
            "225, 4, 125",
            "225, 9, 125",
            "150, 3, 100",
            "110, 1, 100"
    })
    @DisplayName("recommended speed drops 25 per failure, at most 100, never below 100")
    void recommendedWpm(int lastSuccessfulWpm, int failures, int expected) {
        account.setLastSuccessfulWpm(lastSuccessfulWpm);
        account.setConsecutiveFailedAttempts(failures);

        assertThat(service.recommendedWpm(account)).isEqualTo(expected);
    }

    @Test
    @DisplayName("without a passing attempt the recommendation starts from the default speed")
    void recommendedWpmWithoutHistory() {
        account.setConsecutiveFailedAttempts(2);

        assertThat(service.recommendedWpm(account)).isEqualTo(150);
    }

    @Test
    @DisplayName("a pass remembers its speed and clears the failure count")
    void recordAttemptSpeed() {
        service.recordAttemptSpeed(account, 175, false);
        service.recordAttemptSpeed(account, 175, false);
        assertThat(account.getConsecutiveFailedAttempts()).isEqualTo(2);
        assertThat(account.getLastSuccessfulWpm()).isNull();

        service.recordAttemptSpeed(account, 210, true);

        assertThat(account.getConsecutiveFailedAttempts()).isZero();
        assertThat(account.getLastSuccessfulWpm()).isEqualTo(210);
        assertThat(service.recommendedWpm(account)).isEqualTo(210);
        verify(accountRepository, times(3)).save(account);
    }

    private XpTransactionDto bonusEntry() {
        return new XpTransactionDto(UUID.randomUUID(), account.getId(), 2L, XpTransactionType.EARN,
                XpTransactionSource.SPEED_PROGRESSION, 50L, null, 50L, 50L, attemptId, null, null,
                "g-1:progression", LocalDateTime.of(2025, 1, 1, 0, 0));
    }
}

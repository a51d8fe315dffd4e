package uk.gegc.xpeconomy.features.ledger.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mapstruct.factory.Mappers;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.xpeconomy.BaseUnitTest;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.DerivedBalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMetricsService;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.event.XpTransactionRecordedEvent;
import uk.gegc.xpeconomy.features.ledger.domain.exception.IdempotencyConflictException;
import uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException;
import uk.gegc.xpeconomy.features.ledger.domain.exception.SpendingFrozenException;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;
import uk.gegc.xpeconomy.features.ledger.infra.mapping.XpTransactionMapper;
import uk.gegc.xpeconomy.features.ledger.infra.repository.XpTransactionRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LedgerServiceImpl unit tests")
class LedgerServiceImplTest extends BaseUnitTest {

    @Mock private AccountRepository accountRepository;
    @Mock private XpTransactionRepository transactionRepository;
    @Mock private XpMutationExecutor mutationExecutor;
    @Mock private XpMetricsService metricsService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private LedgerServiceImpl ledgerService;
    private UUID accountId;
    private Account account;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        XpTransactionMapper mapper = Mappers.getMapper(XpTransactionMapper.class);
        ledgerService = new LedgerServiceImpl(accountRepository, transactionRepository, mapper, mutationExecutor,
                metricsService, eventPublisher, clock);

        accountId = UUID.randomUUID();
        account = new Account();
        account.setId(accountId);
        account.setUsername("reader");

        lenient().when(mutationExecutor.execute(any(), anyString(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(2)).get());
        lenient().when(transactionRepository.saveAndFlush(any(XpTransaction.class))).thenAnswer(inv -> {
            XpTransaction tx = inv.getArgument(0);
            tx.setId(UUID.randomUUID());
            return tx;
        });
    }

    @Nested
    @DisplayName("earn")
    class Earn {

        @Test
        @DisplayName("credits both balances and writes a positive entry")
        void earnCreditsBothBalances() {
            account.setAccumulatedXp(100);
            account.setSpendableXp(40);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            XpTransactionDto tx = ledgerService.earn(accountId, 25, XpTransactionSource.QUIZ_COMPLETION,
                    "quiz", TransactionRefs.none());

            assertThat(account.getAccumulatedXp()).isEqualTo(125);
            assertThat(account.getSpendableXp()).isEqualTo(65);
            assertThat(tx.amount()).isEqualTo(25);
            assertThat(tx.type()).isEqualTo(XpTransactionType.EARN);
            assertThat(tx.balanceAfter()).isEqualTo(65);
            assertThat(tx.accumulatedAfter()).isEqualTo(125);
            assertThat(tx.sequenceNo()).isEqualTo(1);
            verify(metricsService).recordEarn(accountId, XpTransactionSource.QUIZ_COMPLETION, 25);
        }

        @Test
        @DisplayName("publishes a recorded event for the monitoring layer")
        void earnPublishesEvent() {
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            ledgerService.earn(accountId, 10, XpTransactionSource.ADMIN_ADJUSTMENT, null, null);

            ArgumentCaptor<XpTransactionRecordedEvent> captor = ArgumentCaptor.forClass(XpTransactionRecordedEvent.class);
            verify(eventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getAccountId()).isEqualTo(accountId);
            assertThat(captor.getValue().getType()).isEqualTo(XpTransactionType.EARN);
            assertThat(captor.getValue().getAmount()).isEqualTo(10);
        }

        @Test
        @DisplayName("rejects a spend category on earn without touching the account")
        void earnRejectsSpendCategory() {
            assertThatThrownBy(() -> ledgerService.earn(accountId, 10, XpTransactionSource.FEATURE_PURCHASE,
                    null, TransactionRefs.none()))
                    .isInstanceOf(XpValidationException.class);
            verifyNoInteractions(mutationExecutor, accountRepository);
        }

        @Test
        @DisplayName("rejects a non-positive amount")
        void earnRejectsZero() {
            assertThatThrownBy(() -> ledgerService.earn(accountId, 0, XpTransactionSource.QUIZ_COMPLETION,
                    null, TransactionRefs.none()))
                    .isInstanceOf(XpValidationException.class)
                    .hasMessageContaining("amount");
        }

        @Test
        @DisplayName("unknown account -> ResourceNotFoundException")
        void earnUnknownAccount() {
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ledgerService.earn(accountId, 10, XpTransactionSource.QUIZ_COMPLETION,
                    null, TransactionRefs.none()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("spend")
    class Spend {

        @Test
        @DisplayName("debits spendable only and keeps accumulated XP")
        void spendDebitsSpendable() {
            account.setAccumulatedXp(500);
            account.setSpendableXp(120);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            XpTransactionDto tx = ledgerService.spend(accountId, 100, XpTransactionSource.COMMENT_POST,
                    "comment", TransactionRefs.request("req-1"));

            assertThat(account.getSpendableXp()).isEqualTo(20);
            assertThat(account.getAccumulatedXp()).isEqualTo(500);
            assertThat(tx.amount()).isEqualTo(-100);
            assertThat(tx.balanceAfter()).isEqualTo(20);
            assertThat(tx.idempotencyKey()).isEqualTo("req-1");
            verify(metricsService).recordSpend(accountId, XpTransactionSource.COMMENT_POST, 100);
        }

        @Test
        @DisplayName("insufficient balance fails with the shortfall and writes nothing")
        void spendInsufficient() {
            account.setSpendableXp(80);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            assertThatThrownBy(() -> ledgerService.spend(accountId, 100, XpTransactionSource.COMMENT_POST,
                    null, TransactionRefs.none()))
                    .isInstanceOfSatisfying(InsufficientXpException.class, ex -> {
                        assertThat(ex.getRequired()).isEqualTo(100);
                        assertThat(ex.getAvailable()).isEqualTo(80);
                        assertThat(ex.getShortfall()).isEqualTo(20);
                    });

            assertThat(account.getSpendableXp()).isEqualTo(80);
            verify(transactionRepository, never()).saveAndFlush(any());
            verify(accountRepository, never()).save(any());
            verify(metricsService).recordSpendRejected(accountId, XpTransactionSource.COMMENT_POST, 20);
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("spending the exact balance leaves zero")
        void spendExactBalance() {
            account.setSpendableXp(30);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            ledgerService.spend(accountId, 30, XpTransactionSource.INTERACTION, null, TransactionRefs.none());

            assertThat(account.getSpendableXp()).isZero();
        }

        @Test
        @DisplayName("frozen account cannot spend")
        void spendFrozen() {
            account.setSpendableXp(1000);
            account.setSpendingFrozen(true);
            account.setFrozenReason("BALANCE_DRIFT");
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            assertThatThrownBy(() -> ledgerService.spend(accountId, 10, XpTransactionSource.INTERACTION,
                    null, TransactionRefs.none()))
                    .isInstanceOf(SpendingFrozenException.class)
                    .hasMessageContaining("BALANCE_DRIFT");
            assertThat(account.getSpendableXp()).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("replaying a request id returns the original entry without a second write")
        void replayReturnsOriginal() {
            account.setSpendableXp(70);
            XpTransaction existing = existingSpend("req-7", 30);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));
            when(transactionRepository.findByIdempotencyKey("req-7")).thenReturn(Optional.of(existing));

            XpTransactionDto tx = ledgerService.spend(accountId, 30, XpTransactionSource.INTERACTION, null,
                    TransactionRefs.request("req-7"));

            assertThat(tx.id()).isEqualTo(existing.getId());
            assertThat(account.getSpendableXp()).isEqualTo(70);
            verify(transactionRepository, never()).saveAndFlush(any());
            verify(metricsService).recordIdempotentReplay(XpTransactionSource.INTERACTION);
        }

        @Test
        @DisplayName("reusing a request id for a different amount is a conflict")
        void replayWithDifferentAmount() {
            XpTransaction existing = existingSpend("req-8", 30);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));
            when(transactionRepository.findByIdempotencyKey("req-8")).thenReturn(Optional.of(existing));

            assertThatThrownBy(() -> ledgerService.spend(accountId, 15, XpTransactionSource.INTERACTION, null,
                    TransactionRefs.request("req-8")))
                    .isInstanceOf(IdempotencyConflictException.class);
        }

        @Test
        @DisplayName("reusing a request id for another category of the same amount is a conflict")
        void replayWithDifferentSource() {
            account.setSpendableXp(70);
            XpTransaction existing = existingSpend("req-9", 30);
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));
            when(transactionRepository.findByIdempotencyKey("req-9")).thenReturn(Optional.of(existing));

            assertThatThrownBy(() -> ledgerService.spend(accountId, 30, XpTransactionSource.REPORT, null,
                    TransactionRefs.request("req-9")))
                    .isInstanceOf(IdempotencyConflictException.class);
            assertThat(account.getSpendableXp()).isEqualTo(70);
            verify(transactionRepository, never()).saveAndFlush(any());
            verify(metricsService, never()).recordIdempotentReplay(any());
        }

        @Test
        @DisplayName("blank request id is treated as no key")
        void blankKeyIgnored() {
            when(accountRepository.findByIdForUpdate(accountId)).thenReturn(Optional.of(account));

            XpTransactionDto tx = ledgerService.earn(accountId, 5, XpTransactionSource.QUIZ_COMPLETION, null,
                    TransactionRefs.request("  "));

            assertThat(tx.idempotencyKey()).isNull();
            verify(transactionRepository, never()).findByIdempotencyKey(anyString());
        }

        private XpTransaction existingSpend(String key, long amount) {
            XpTransaction tx = new XpTransaction();
            tx.setId(UUID.randomUUID());
            tx.setAccountId(accountId);
            tx.setType(XpTransactionType.SPEND);
            tx.setSource(XpTransactionSource.INTERACTION);
            tx.setAmount(-amount);
            tx.setIdempotencyKey(key);
            return tx;
        }
    }

    @Test
    @DisplayName("getDerivedBalance: stored balances next to the ledger sums")
    void derivedBalance() {
        account.setAccumulatedXp(300);
        account.setSpendableXp(120);
        when(accountRepository.findById(accountId)).thenReturn(Optional.of(account));
        when(transactionRepository.sumAmountByAccountId(accountId)).thenReturn(120L);
        when(transactionRepository.sumAmountByAccountIdAndType(eq(accountId), eq(XpTransactionType.EARN)))
                .thenReturn(300L);
        when(transactionRepository.countByAccountId(accountId)).thenReturn(4L);

        DerivedBalanceDto derived = ledgerService.getDerivedBalance(accountId);

        assertThat(derived.consistent()).isTrue();
        assertThat(derived.entryCount()).isEqualTo(4);
    }
}

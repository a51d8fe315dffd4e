package uk.gegc.xpeconomy.features.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import uk.gegc.xpeconomy.BaseIntegrationTest;
import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.account.application.AccountService;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.DerivedBalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;
import uk.gegc.xpeconomy.features.ledger.infra.repository.XpTransactionRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Ledger concurrency and invariants")
class LedgerConcurrencyIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private XpTransactionRepository transactionRepository;

    @Test
    @DisplayName("N concurrent spends of A against balance B: exactly floor(B / A) succeed")
    void concurrentSpendsNeverOverdraw() throws Exception {
        UUID accountId = newAccount();
        ledgerService.earn(accountId, 100, XpTransactionSource.ADMIN_ADJUSTMENT, "seed", TransactionRefs.none());

        int threads = 10;
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        runConcurrently(threads, i -> {
            try {
                ledgerService.spend(accountId, 30, XpTransactionSource.INTERACTION, "spend " + i, TransactionRefs.none());
                succeeded.incrementAndGet();
            } catch (InsufficientXpException e) {
                rejected.incrementAndGet();
            }
        });

        assertThat(succeeded.get()).isEqualTo(3);
        assertThat(rejected.get()).isEqualTo(7);

        BalanceDto balance = ledgerService.getBalance(accountId);
        assertThat(balance.spendableXp()).isEqualTo(10);
        assertThat(balance.accumulatedXp()).isEqualTo(100);
        assertLedgerMatches(accountId);
    }

    @Test
    @DisplayName("the same request id raced from many threads is applied once")
    void concurrentReplaysApplyOnce() throws Exception {
        UUID accountId = newAccount();
        String requestId = "race-" + UUID.randomUUID();
        Set<UUID> returnedIds = ConcurrentHashMap.newKeySet();

        runConcurrently(8, i -> returnedIds.add(ledgerService.earn(accountId, 50,
                XpTransactionSource.QUIZ_COMPLETION, "quiz", TransactionRefs.request(requestId)).id()));

        assertThat(returnedIds).hasSize(1);
        assertThat(ledgerService.getBalance(accountId).spendableXp()).isEqualTo(50);
        assertThat(transactionRepository.countByAccountId(accountId)).isEqualTo(1);
    }

    @Test
    @DisplayName("interleaved earns and spends keep stored balances equal to the ledger sums")
    void mixedTrafficKeepsInvariants() throws Exception {
        UUID accountId = newAccount();
        ledgerService.earn(accountId, 50, XpTransactionSource.ADMIN_ADJUSTMENT, "seed", TransactionRefs.none());

        runConcurrently(12, i -> {
            if (i % 2 == 0) {
                ledgerService.earn(accountId, 20, XpTransactionSource.QUIZ_COMPLETION, null, TransactionRefs.none());
            } else {
                try {
                    ledgerService.spend(accountId, 25, XpTransactionSource.INTERACTION, null, TransactionRefs.none());
                } catch (InsufficientXpException ignored) {
                    // a rejected spend is a valid outcome of the race
                }
            }
        });

        assertLedgerMatches(accountId);
        assertThat(ledgerService.getBalance(accountId).accumulatedXp()).isEqualTo(50 + 6 * 20);

        List<XpTransactionDto> history = ledgerService
                .listTransactions(accountId, null, null, null, null, Pageable.unpaged())
                .getContent();
        assertThat(history).allSatisfy(tx -> assertThat(tx.balanceAfter()).isNotNegative());
        assertThat(history).extracting(XpTransactionDto::sequenceNo).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("history filters by type")
    void historyFiltersByType() {
        UUID accountId = newAccount();
        ledgerService.earn(accountId, 40, XpTransactionSource.QUIZ_COMPLETION, null, TransactionRefs.none());
        ledgerService.spend(accountId, 15, XpTransactionSource.INTERACTION, null, TransactionRefs.none());

        List<XpTransactionDto> spends = ledgerService
                .listTransactions(accountId, XpTransactionType.SPEND, null, null, null,
                        PageRequest.of(0, 10))
                .getContent();

        assertThat(spends).singleElement().satisfies(tx -> {
            assertThat(tx.amount()).isEqualTo(-15);
            assertThat(tx.balanceAfter()).isEqualTo(25);
        });
    }

    private void assertLedgerMatches(UUID accountId) {
        DerivedBalanceDto derived = ledgerService.getDerivedBalance(accountId);
        assertThat(derived.consistent())
                .as("stored %s/%s vs derived %s/%s", derived.storedAccumulatedXp(), derived.storedSpendableXp(),
                        derived.derivedAccumulatedXp(), derived.derivedSpendableXp())
                .isTrue();
        assertThat(derived.storedSpendableXp()).isNotNegative();
    }

    private UUID newAccount() {
        AccountDto account = accountService.registerAccount("ledger-" + UUID.randomUUID());
        return account.id();
    }

    private void runConcurrently(int threads, IndexedTask task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    task.run(index);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface IndexedTask {
        void run(int index) throws Exception;
    }
}

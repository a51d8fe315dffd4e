package uk.gegc.xpeconomy.features.ledger.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.xpeconomy.features.ledger.domain.exception.TransientConflictException;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs an XP mutation as one all-or-nothing unit of work.
 * <p>
 * Called outside a transaction, the work gets its own transaction and is retried a bounded number
 * of times when it loses a lock or unique-key race; the retry re-reads everything, so an idempotent
 * replay resolves on the next pass. Called inside a transaction, the work joins it and the outermost
 * caller owns the retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XpMutationExecutor {

    private final TransactionTemplate transactionTemplate;
    private final LedgerProperties ledgerProperties;
    private final XpMetricsService metricsService;

    public <T> T execute(UUID accountId, String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        int maxAttempts = ledgerProperties.getMaxAttempts();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (attempt >= maxAttempts) {
                    metricsService.recordConflictExhausted(operation);
                    log.warn("Giving up on {} for account {} after {} attempts: {}",
                            operation, accountId, attempt, e.getMessage());
                    throw new TransientConflictException(
                            "Account " + accountId + " is busy, " + operation + " was not applied",
                            attempt, ledgerProperties.getRetryAfterSeconds(), e);
                }
                metricsService.recordConflictRetry(operation);
                log.debug("Retrying {} for account {} (attempt {}/{}): {}",
                        operation, accountId, attempt, maxAttempts, e.getMessage());
                pause(attempt, accountId, operation, e);
            }
        }
    }

    public void run(UUID accountId, String operation, Runnable work) {
        execute(accountId, operation, () -> {
            work.run();
            return null;
        });
    }

    private void pause(int attempt, UUID accountId, String operation, RuntimeException cause) {
        long backoff = ledgerProperties.getRetryBackoffMillis() * attempt;
        if (backoff <= 0) {
            return;
        }
        try {
            Thread.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientConflictException(
                    "Interrupted while retrying " + operation + " for account " + accountId,
                    attempt, ledgerProperties.getRetryAfterSeconds(), cause);
        }
    }
}

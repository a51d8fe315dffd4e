package uk.gegc.xpeconomy.features.ledger.application;

import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;

import java.util.UUID;

/**
 * Counters for XP flow and ledger health.
 */
public interface XpMetricsService {

    void recordEarn(UUID accountId, XpTransactionSource source, long amount);

    void recordSpend(UUID accountId, XpTransactionSource source, long amount);

    void recordSpendRejected(UUID accountId, XpTransactionSource source, long shortfall);

    void recordIdempotentReplay(XpTransactionSource source);

    void recordConflictRetry(String operation);

    void recordConflictExhausted(String operation);

    void recordReconciliationSuccess(UUID accountId);

    void recordReconciliationDrift(UUID accountId, long driftAmount);

    void recordReviewFlag(UUID accountId, String flagType);
}

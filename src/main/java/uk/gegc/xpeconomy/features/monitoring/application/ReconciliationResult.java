package uk.gegc.xpeconomy.features.monitoring.application;

import uk.gegc.xpeconomy.features.monitoring.domain.model.ReviewFlagType;

import java.util.List;
import java.util.UUID;

/**
 * Stored balances next to what the ledger says they should be.
 *
 * @param lastBalanceAfter {@code balance_after} of the newest entry, null for an account with no entries
 */
public record ReconciliationResult(
        UUID accountId,
        long storedSpendableXp,
        long derivedSpendableXp,
        long storedAccumulatedXp,
        long derivedAccumulatedXp,
        Long lastBalanceAfter,
        long entryCount,
        List<ReviewFlagType> violations
) {

    public boolean consistent() {
        return violations.isEmpty();
    }
}

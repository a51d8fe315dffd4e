package uk.gegc.xpeconomy.features.ledger.api.dto;

import java.util.UUID;

/**
 * Balances recomputed purely from the transaction log, next to the stored ones.
 */
public record DerivedBalanceDto(
        UUID accountId,
        long storedAccumulatedXp,
        long storedSpendableXp,
        long derivedAccumulatedXp,
        long derivedSpendableXp,
        long entryCount
) {
    public boolean consistent() {
        return storedAccumulatedXp == derivedAccumulatedXp && storedSpendableXp == derivedSpendableXp;
    }
}

package uk.gegc.xpeconomy.features.ledger.domain.exception;

import java.util.UUID;

public class SpendingFrozenException extends RuntimeException {

    private final UUID accountId;

    public SpendingFrozenException(UUID accountId, String reason) {
        super("Spending is frozen for account " + accountId + (reason != null ? ": " + reason : ""));
        this.accountId = accountId;
    }

    public UUID getAccountId() {
        return accountId;
    }
}

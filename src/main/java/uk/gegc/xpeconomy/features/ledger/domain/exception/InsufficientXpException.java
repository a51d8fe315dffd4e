package uk.gegc.xpeconomy.features.ledger.domain.exception;

import java.util.UUID;

public class InsufficientXpException extends RuntimeException {

    private final UUID accountId;
    private final long required;
    private final long available;
    private final long shortfall;

    public InsufficientXpException(UUID accountId, long required, long available) {
        super("Not enough spendable XP: required=" + required + ", available=" + available);
        this.accountId = accountId;
        this.required = required;
        this.available = available;
        this.shortfall = required - available;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    public long getShortfall() {
        return shortfall;
    }
}

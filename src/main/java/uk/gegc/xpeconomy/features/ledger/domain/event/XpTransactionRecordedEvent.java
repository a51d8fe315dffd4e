package uk.gegc.xpeconomy.features.ledger.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

import java.util.UUID;

/**
 * Published inside the writing transaction for every new ledger entry (replays excluded).
 * Listeners that must only see durable data bind to the after-commit phase.
 */
public class XpTransactionRecordedEvent extends ApplicationEvent {

    private final UUID transactionId;
    private final UUID accountId;
    private final XpTransactionType type;
    private final XpTransactionSource xpSource;
    private final long amount;

    public XpTransactionRecordedEvent(Object source, UUID transactionId, UUID accountId,
                                      XpTransactionType type, XpTransactionSource xpSource, long amount) {
        super(source);
        this.transactionId = transactionId;
        this.accountId = accountId;
        this.type = type;
        this.xpSource = xpSource;
        this.amount = amount;
    }

    public UUID getTransactionId() {
        return transactionId;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public XpTransactionType getType() {
        return type;
    }

    public XpTransactionSource getXpSource() {
        return xpSource;
    }

    public long getAmount() {
        return amount;
    }
}

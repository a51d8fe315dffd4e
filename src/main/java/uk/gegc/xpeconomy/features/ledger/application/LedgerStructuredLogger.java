package uk.gegc.xpeconomy.features.ledger.application;

import org.slf4j.Logger;
import org.slf4j.MDC;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;

import java.util.UUID;

/**
 * Structured logging for ledger operations. Fields go to the MDC for the duration of one log call.
 */
public final class LedgerStructuredLogger {

    private LedgerStructuredLogger() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static void logLedgerWrite(Logger logger, String message, XpTransaction tx, Object... args) {
        MDC.put("xp.accountId", tx.getAccountId() != null ? tx.getAccountId().toString() : null);
        MDC.put("xp.txId", tx.getId() != null ? tx.getId().toString() : null);
        MDC.put("xp.txType", tx.getType() != null ? tx.getType().name() : null);
        MDC.put("xp.source", tx.getSource() != null ? tx.getSource().name() : null);
        MDC.put("xp.amount", String.valueOf(tx.getAmount()));
        MDC.put("xp.balanceAfter", String.valueOf(tx.getBalanceAfter()));
        MDC.put("xp.idempotencyKey", tx.getIdempotencyKey());
        try {
            logger.info(message, args);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void logRejectedSpend(Logger logger, String message, UUID accountId, long required,
                                        long available, Object... args) {
        MDC.put("xp.accountId", accountId != null ? accountId.toString() : null);
        MDC.put("xp.txType", "SPEND");
        MDC.put("xp.amount", String.valueOf(required));
        MDC.put("xp.balanceAfter", String.valueOf(available));
        try {
            logger.warn(message, args);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove("xp.accountId");
        MDC.remove("xp.txId");
        MDC.remove("xp.txType");
        MDC.remove("xp.source");
        MDC.remove("xp.amount");
        MDC.remove("xp.balanceAfter");
        MDC.remove("xp.idempotencyKey");
    }
}

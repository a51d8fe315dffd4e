package uk.gegc.xpeconomy.features.ledger.domain.exception;

/**
 * Raised once the bounded retry budget for a contended account is spent.
 * Nothing was written; the caller may retry the whole request later.
 */
public class TransientConflictException extends RuntimeException {

    private final int attempts;
    private final long retryAfterSeconds;

    public TransientConflictException(String message, int attempts, long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

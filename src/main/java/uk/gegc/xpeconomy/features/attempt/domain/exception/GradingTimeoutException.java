package uk.gegc.xpeconomy.features.attempt.domain.exception;

public class GradingTimeoutException extends RuntimeException {

    public GradingTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

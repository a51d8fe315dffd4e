package uk.gegc.xpeconomy.features.attempt.domain.exception;

public class GradingFailedException extends RuntimeException {

    public GradingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

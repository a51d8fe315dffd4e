package uk.gegc.xpeconomy.shared.exception;

/**
 * Malformed input to an XP operation: out-of-range score, non-positive amount,
 * unsupported reading speed and similar. Nothing is mutated when it is thrown.
 */
public class XpValidationException extends RuntimeException {

    public XpValidationException(String message) {
        super(message);
    }
}

package uk.gegc.xpeconomy.features.account.domain.exception;

public class DuplicateAccountException extends RuntimeException {

    public DuplicateAccountException(String username) {
        super("An account already exists for username " + username);
    }
}

package uk.gegc.xpeconomy.features.account.application;

import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;

import java.util.UUID;

public interface AccountService {

    /**
     * Opens an account with zero balances and the default reading speeds.
     *
     * @throws uk.gegc.xpeconomy.features.account.domain.exception.DuplicateAccountException if the username is taken
     */
    AccountDto registerAccount(String username);

    AccountDto getAccount(UUID accountId);

    AccountDto getAccountByUsername(String username);
}

package uk.gegc.xpeconomy.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.account.application.AccountService;
import uk.gegc.xpeconomy.features.account.domain.exception.DuplicateAccountException;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.mapping.AccountMapper;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.progression.application.ProgressionProperties;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;
    private final AccountMapper accountMapper;
    private final ProgressionProperties progressionProperties;
    private final Clock clock;

    @Override
    @Transactional
    public AccountDto registerAccount(String username) {
        if (username == null || username.isBlank()) {
            throw new XpValidationException("username must not be blank");
        }
        String normalized = username.trim();
        if (accountRepository.existsByUsername(normalized)) {
            throw new DuplicateAccountException(normalized);
        }

        Account account = new Account();
        account.setUsername(normalized);
        account.setAccumulatedXp(0L);
        account.setSpendableXp(0L);
        account.setCurrentWpm(progressionProperties.getInitialCurrentWpm());
        account.setMaxWpm(progressionProperties.getInitialMaxWpm());
        account.setCreatedAt(LocalDateTime.now(clock));
        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // concurrent registration of the same username
            throw new DuplicateAccountException(normalized);
        }

        log.info("Registered XP account {} for {}", account.getId(), normalized);
        return accountMapper.toDto(account);
    }

    @Override
    @Transactional(readOnly = true)
    public AccountDto getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(accountMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public AccountDto getAccountByUsername(String username) {
        return accountRepository.findByUsername(username)
                .map(accountMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Account for " + username + " not found"));
    }
}

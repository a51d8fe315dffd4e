package uk.gegc.xpeconomy.features.ledger.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.DerivedBalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.LedgerStructuredLogger;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMetricsService;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.event.XpTransactionRecordedEvent;
import uk.gegc.xpeconomy.features.ledger.domain.exception.IdempotencyConflictException;
import uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException;
import uk.gegc.xpeconomy.features.ledger.domain.exception.SpendingFrozenException;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;
import uk.gegc.xpeconomy.features.ledger.infra.mapping.XpTransactionMapper;
import uk.gegc.xpeconomy.features.ledger.infra.repository.XpTransactionRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class LedgerServiceImpl implements LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerServiceImpl.class);

    private final AccountRepository accountRepository;
    private final XpTransactionRepository transactionRepository;
    private final XpTransactionMapper transactionMapper;
    private final XpMutationExecutor mutationExecutor;
    private final XpMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public XpTransactionDto earn(UUID accountId, long amount, XpTransactionSource source, String description,
                                 TransactionRefs refs) {
        validate(amount, source, XpTransactionType.EARN);
        return mutationExecutor.execute(accountId, "earn",
                () -> transactionMapper.toDto(record(accountId, XpTransactionType.EARN, amount, source, description, refs)));
    }

    @Override
    public XpTransactionDto spend(UUID accountId, long amount, XpTransactionSource purpose, String description,
                                  TransactionRefs refs) {
        validate(amount, purpose, XpTransactionType.SPEND);
        return mutationExecutor.execute(accountId, "spend",
                () -> transactionMapper.toDto(record(accountId, XpTransactionType.SPEND, amount, purpose, description, refs)));
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
        return new BalanceDto(account.getId(), account.getAccumulatedXp(), account.getSpendableXp());
    }

    @Override
    @Transactional(readOnly = true)
    public Page<XpTransactionDto> listTransactions(UUID accountId,
                                                   XpTransactionType type,
                                                   XpTransactionSource source,
                                                   LocalDateTime dateFrom,
                                                   LocalDateTime dateTo,
                                                   Pageable pageable) {
        if (!accountRepository.existsById(accountId)) {
            throw new ResourceNotFoundException("Account " + accountId + " not found");
        }
        return transactionRepository
                .findByFilters(accountId, type, source, dateFrom, dateTo, pageable)
                .map(transactionMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public DerivedBalanceDto getDerivedBalance(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
        long derivedSpendable = transactionRepository.sumAmountByAccountId(accountId);
        long derivedAccumulated = transactionRepository.sumAmountByAccountIdAndType(accountId, XpTransactionType.EARN);
        return new DerivedBalanceDto(
                accountId,
                account.getAccumulatedXp(),
                account.getSpendableXp(),
                derivedAccumulated,
                derivedSpendable,
                transactionRepository.countByAccountId(accountId)
        );
    }

    private void validate(long amount, XpTransactionSource source, XpTransactionType expected) {
        if (amount <= 0) {
            throw new XpValidationException("amount must be > 0");
        }
        if (source == null) {
            throw new XpValidationException("source must be provided");
        }
        if (source.getDirection() != expected) {
            throw new XpValidationException(source + " is not a valid " + expected + " category");
        }
    }

    /**
     * Applies one mutation. Must run inside a transaction; the account row lock taken first
     * linearizes all writers for this account.
     */
    private XpTransaction record(UUID accountId, XpTransactionType type, long amount, XpTransactionSource source,
                                 String description, TransactionRefs refs) {
        TransactionRefs references = refs != null ? refs : TransactionRefs.none();
        Account account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));

        String idempotencyKey = references.requestId();
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            Optional<XpTransaction> existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                return replay(existing.get(), accountId, type, amount, source);
            }
        } else {
            idempotencyKey = null;
        }

        long spendable = account.getSpendableXp();
        if (type == XpTransactionType.SPEND) {
            if (account.isSpendingFrozen()) {
                throw new SpendingFrozenException(accountId, account.getFrozenReason());
            }
            if (spendable < amount) {
                metricsService.recordSpendRejected(accountId, source, amount - spendable);
                LedgerStructuredLogger.logRejectedSpend(log, "Rejected {} spend of {} XP for account {}",
                        accountId, amount, spendable, source, amount, accountId);
                throw new InsufficientXpException(accountId, amount, spendable);
            }
            account.setSpendableXp(spendable - amount);
        } else {
            account.setAccumulatedXp(account.getAccumulatedXp() + amount);
            account.setSpendableXp(spendable + amount);
        }
        account.setLedgerSequence(account.getLedgerSequence() + 1);

        XpTransaction tx = new XpTransaction();
        tx.setAccountId(accountId);
        tx.setSequenceNo(account.getLedgerSequence());
        tx.setType(type);
        tx.setSource(source);
        tx.setAmount(type == XpTransactionType.EARN ? amount : -amount);
        tx.setDescription(truncate(description));
        tx.setBalanceAfter(account.getSpendableXp());
        tx.setAccumulatedAfter(account.getAccumulatedXp());
        tx.setQuizAttemptId(references.quizAttemptId());
        tx.setCommentRef(references.commentRef());
        tx.setFeatureRef(references.featureRef());
        tx.setIdempotencyKey(idempotencyKey);
        tx.setCreatedAt(LocalDateTime.now(clock));

        accountRepository.save(account);
        tx = transactionRepository.saveAndFlush(tx);

        LedgerStructuredLogger.logLedgerWrite(log, "Ledger {} of {} XP ({}) for account {}, spendable now {}",
                tx, type, amount, source, accountId, tx.getBalanceAfter());
        if (type == XpTransactionType.EARN) {
            metricsService.recordEarn(accountId, source, amount);
        } else {
            metricsService.recordSpend(accountId, source, amount);
        }
        eventPublisher.publishEvent(new XpTransactionRecordedEvent(this, tx.getId(), accountId, type, source, amount));
        return tx;
    }

    private XpTransaction replay(XpTransaction existing, UUID accountId, XpTransactionType type, long amount,
                                 XpTransactionSource source) {
        if (!existing.getAccountId().equals(accountId)
                || existing.getType() != type
                || existing.getSource() != source
                || existing.magnitude() != amount) {
            throw new IdempotencyConflictException(
                    "Request id " + existing.getIdempotencyKey() + " was already used for a different XP operation");
        }
        metricsService.recordIdempotentReplay(existing.getSource());
        log.info("Idempotent replay of {} for account {} returns transaction {}",
                existing.getIdempotencyKey(), accountId, existing.getId());
        return existing;
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= 255) {
            return description;
        }
        return description.substring(0, 255);
    }
}

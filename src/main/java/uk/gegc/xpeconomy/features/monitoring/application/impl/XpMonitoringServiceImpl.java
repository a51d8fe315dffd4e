package uk.gegc.xpeconomy.features.monitoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.mapping.AccountMapper;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.application.XpMetricsService;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;
import uk.gegc.xpeconomy.features.ledger.infra.repository.XpTransactionRepository;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AccountReviewFlagDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AnomalyDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.EconomyMetricsDto;
import uk.gegc.xpeconomy.features.monitoring.application.MonitoringProperties;
import uk.gegc.xpeconomy.features.monitoring.application.ReconciliationResult;
import uk.gegc.xpeconomy.features.monitoring.application.ReconciliationSummary;
import uk.gegc.xpeconomy.features.monitoring.application.XpMonitoringService;
import uk.gegc.xpeconomy.features.monitoring.domain.model.AccountReviewFlag;
import uk.gegc.xpeconomy.features.monitoring.domain.model.ReviewFlagType;
import uk.gegc.xpeconomy.features.monitoring.infra.mapping.ReviewFlagMapper;
import uk.gegc.xpeconomy.features.monitoring.infra.repository.AccountReviewFlagRepository;
import uk.gegc.xpeconomy.features.store.infra.repository.FeaturePurchaseRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class XpMonitoringServiceImpl implements XpMonitoringService {

    private final AccountRepository accountRepository;
    private final XpTransactionRepository transactionRepository;
    private final AccountReviewFlagRepository flagRepository;
    private final FeaturePurchaseRepository purchaseRepository;
    private final ReviewFlagMapper flagMapper;
    private final AccountMapper accountMapper;
    private final XpMetricsService metricsService;
    private final MonitoringProperties monitoringProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public ReconciliationResult reconcileAccount(UUID accountId) {
        return transactionTemplate.execute(status -> doReconcile(accountId));
    }

    @Override
    public ReconciliationSummary reconcileAllAccounts() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<UUID> accountIds = accountRepository.findAllIds();
        List<ReconciliationResult> violations = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();
        int consistent = 0;

        for (UUID accountId : accountIds) {
            try {
                ReconciliationResult result = reconcileAccount(accountId);
                if (result.consistent()) {
                    consistent++;
                } else {
                    violations.add(result);
                }
            } catch (RuntimeException e) {
                failed.add(accountId);
                log.error("Reconciliation of account {} failed: {}", accountId, e.getMessage(), e);
            }
        }

        LocalDateTime finishedAt = LocalDateTime.now(clock);
        log.info("Reconciliation checked {} accounts: {} consistent, {} with violations, {} failed",
                accountIds.size(), consistent, violations.size(), failed.size());
        return new ReconciliationSummary(accountIds.size(), consistent, violations, failed, startedAt, finishedAt);
    }

    @Scheduled(cron = "${xp.monitoring.reconciliation-cron:0 0 3 * * *}")
    public void scheduledReconciliation() {
        log.info("Starting scheduled XP reconciliation");
        reconcileAllAccounts();
    }

    @Override
    public boolean checkVelocity(UUID accountId) {
        LocalDateTime since = LocalDateTime.now(clock).minus(monitoringProperties.getVelocityWindow());
        long earned = transactionRepository.sumAmountByAccountIdAndTypeSince(accountId, XpTransactionType.EARN, since);
        long threshold = monitoringProperties.getVelocityThreshold();
        if (earned <= threshold) {
            return false;
        }

        log.warn("Account {} earned {} XP within {} (threshold {})",
                accountId, earned, monitoringProperties.getVelocityWindow(), threshold);
        transactionTemplate.executeWithoutResult(status -> {
            Account account = lockAccount(accountId);
            raiseFlag(account, ReviewFlagType.XP_VELOCITY, earned, threshold,
                    "Earned " + earned + " XP since " + since, monitoringProperties.isFreezeOnVelocity());
        });
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccountReviewFlagDto> listOpenFlags(UUID accountId) {
        List<AccountReviewFlag> flags = accountId != null
                ? flagRepository.findByAccountIdAndResolvedFalseOrderByCreatedAtDesc(accountId)
                : flagRepository.findByResolvedFalseOrderByCreatedAtDesc();
        return flagMapper.toDtos(flags);
    }

    @Override
    @Transactional
    public AccountDto unfreeze(UUID accountId, String note) {
        Account account = lockAccount(accountId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<AccountReviewFlag> open = flagRepository.findByAccountIdAndResolvedFalseOrderByCreatedAtDesc(accountId);
        for (AccountReviewFlag flag : open) {
            flag.setResolved(true);
            flag.setResolutionNote(note);
            flag.setResolvedAt(now);
        }
        flagRepository.saveAll(open);

        boolean wasFrozen = account.isSpendingFrozen();
        account.setSpendingFrozen(false);
        account.setFrozenReason(null);
        account = accountRepository.save(account);

        log.info("Account {} reviewed: {} flags resolved, spending was {}frozen. Note: {}",
                accountId, open.size(), wasFrozen ? "" : "not ", note);
        return accountMapper.toDto(account);
    }

    @Override
    @Transactional(readOnly = true)
    public EconomyMetricsDto getEconomyMetrics() {
        LocalDateTime since = LocalDateTime.now(clock).minus(monitoringProperties.getEconomyMetricsWindow());
        long earned = transactionRepository.sumAmountByTypeSince(XpTransactionType.EARN, since);
        long spent = -transactionRepository.sumAmountByTypeSince(XpTransactionType.SPEND, since);
        return new EconomyMetricsDto(
                since,
                transactionRepository.countByCreatedAtGreaterThanEqual(since),
                earned,
                spent,
                earned - spent,
                transactionRepository.countDistinctAccountsSince(since),
                purchaseRepository.countByPurchasedAtGreaterThanEqual(since),
                accountRepository.findBySpendingFrozenTrue().size(),
                flagRepository.findByResolvedFalseOrderByCreatedAtDesc().size(),
                earned > spent ? "HEALTHY" : "DEFLATION"
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnomalyDto> detectAnomalies() {
        List<AnomalyDto> anomalies = new ArrayList<>();

        List<Account> negative = accountRepository.findBySpendableXpLessThan(0L);
        if (!negative.isEmpty()) {
            anomalies.add(new AnomalyDto("NEGATIVE_BALANCE", "CRITICAL", negative.size(), 0L, idsOf(negative)));
        }

        long highBalance = monitoringProperties.getHighBalanceThreshold();
        List<Account> rich = accountRepository.findBySpendableXpGreaterThan(highBalance);
        if (!rich.isEmpty()) {
            anomalies.add(new AnomalyDto("HIGH_BALANCE", "WARNING", rich.size(), highBalance, idsOf(rich)));
        }

        long largeTx = monitoringProperties.getLargeTransactionThreshold();
        LocalDateTime since = LocalDateTime.now(clock).minus(monitoringProperties.getAnomalyWindow());
        List<XpTransaction> large = transactionRepository.findByAmountGreaterThanAndCreatedAtGreaterThanEqual(largeTx, since);
        if (!large.isEmpty()) {
            List<UUID> accounts = large.stream().map(XpTransaction::getAccountId).distinct().toList();
            anomalies.add(new AnomalyDto("LARGE_TRANSACTIONS", "WARNING", large.size(), largeTx, accounts));
        }

        if (!anomalies.isEmpty()) {
            log.warn("Detected {} XP anomaly types: {}", anomalies.size(),
                    anomalies.stream().map(AnomalyDto::type).toList());
        }
        return anomalies;
    }

    private ReconciliationResult doReconcile(UUID accountId) {
        // lock so the stored balances and the sums describe the same ledger state
        Account account = lockAccount(accountId);

        long derivedSpendable = transactionRepository.sumAmountByAccountId(accountId);
        long derivedAccumulated = transactionRepository.sumAmountByAccountIdAndType(accountId, XpTransactionType.EARN);
        Long lastBalanceAfter = transactionRepository.findFirstByAccountIdOrderBySequenceNoDesc(accountId)
                .map(XpTransaction::getBalanceAfter)
                .orElse(null);
        long entryCount = transactionRepository.countByAccountId(accountId);

        long storedSpendable = account.getSpendableXp();
        long storedAccumulated = account.getAccumulatedXp();
        List<ReviewFlagType> violations = new ArrayList<>();

        if (storedSpendable < 0) {
            violations.add(ReviewFlagType.NEGATIVE_BALANCE);
            log.error("Account {} has a negative spendable balance of {}", accountId, storedSpendable);
            raiseFlag(account, ReviewFlagType.NEGATIVE_BALANCE, storedSpendable, 0L,
                    "Spendable balance is " + storedSpendable, monitoringProperties.isFreezeOnViolation());
        }

        long expectedFromLast = lastBalanceAfter != null ? lastBalanceAfter : 0L;
        if (storedSpendable != derivedSpendable || storedSpendable != expectedFromLast) {
            violations.add(ReviewFlagType.BALANCE_DRIFT);
            log.error("Account {} spendable drift: stored={}, ledger sum={}, last balance_after={}",
                    accountId, storedSpendable, derivedSpendable, lastBalanceAfter);
            metricsService.recordReconciliationDrift(accountId, storedSpendable - derivedSpendable);
            raiseFlag(account, ReviewFlagType.BALANCE_DRIFT, storedSpendable, derivedSpendable,
                    "Ledger sum " + derivedSpendable + ", last balance_after " + lastBalanceAfter,
                    monitoringProperties.isFreezeOnViolation());
        }

        if (storedAccumulated != derivedAccumulated) {
            violations.add(ReviewFlagType.ACCUMULATED_DRIFT);
            log.error("Account {} accumulated drift: stored={}, EARN sum={}",
                    accountId, storedAccumulated, derivedAccumulated);
            metricsService.recordReconciliationDrift(accountId, storedAccumulated - derivedAccumulated);
            raiseFlag(account, ReviewFlagType.ACCUMULATED_DRIFT, storedAccumulated, derivedAccumulated,
                    "EARN sum " + derivedAccumulated, monitoringProperties.isFreezeOnViolation());
        }

        if (violations.isEmpty()) {
            metricsService.recordReconciliationSuccess(accountId);
            log.debug("Account {} reconciled: spendable={}, accumulated={}, entries={}",
                    accountId, storedSpendable, storedAccumulated, entryCount);
        }

        return new ReconciliationResult(accountId, storedSpendable, derivedSpendable, storedAccumulated,
                derivedAccumulated, lastBalanceAfter, entryCount, List.copyOf(violations));
    }

    /**
     * Stores a flag unless one of the same type is already open. Caller holds the account lock.
     */
    private void raiseFlag(Account account, ReviewFlagType type, long observed, long expected, String details,
                           boolean freeze) {
        if (flagRepository.existsByAccountIdAndFlagTypeAndResolvedFalse(account.getId(), type)) {
            log.debug("Account {} already has an open {} flag", account.getId(), type);
            return;
        }

        AccountReviewFlag flag = new AccountReviewFlag();
        flag.setAccountId(account.getId());
        flag.setFlagType(type);
        flag.setObservedValue(observed);
        flag.setExpectedValue(expected);
        flag.setDetails(details);
        flag.setSpendingFrozen(freeze);
        flag.setCreatedAt(LocalDateTime.now(clock));
        flagRepository.save(flag);
        metricsService.recordReviewFlag(account.getId(), type.name());

        if (freeze && !account.isSpendingFrozen()) {
            account.setSpendingFrozen(true);
            account.setFrozenReason(type + ": " + details);
            accountRepository.save(account);
            log.warn("Spending frozen for account {} pending review of {}", account.getId(), type);
        }
    }

    private Account lockAccount(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }

    private static List<UUID> idsOf(List<Account> accounts) {
        return accounts.stream().map(Account::getId).toList();
    }
}

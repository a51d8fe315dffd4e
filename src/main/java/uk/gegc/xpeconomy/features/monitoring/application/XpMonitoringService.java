package uk.gegc.xpeconomy.features.monitoring.application;

import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AccountReviewFlagDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AnomalyDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.EconomyMetricsDto;

import java.util.List;
import java.util.UUID;

/**
 * Detects ledger inconsistencies and suspicious XP flow. Never repairs balances: findings are logged,
 * counted and stored as review flags, and may freeze spending until an operator steps in.
 */
public interface XpMonitoringService {

    ReconciliationResult reconcileAccount(UUID accountId);

    ReconciliationSummary reconcileAllAccounts();

    /**
     * @return true if the account earned more than the velocity threshold inside the window
     */
    boolean checkVelocity(UUID accountId);

    List<AccountReviewFlagDto> listOpenFlags(UUID accountId);

    /**
     * Lifts a spending freeze and resolves the account's open flags.
     */
    AccountDto unfreeze(UUID accountId, String note);

    EconomyMetricsDto getEconomyMetrics();

    List<AnomalyDto> detectAnomalies();
}

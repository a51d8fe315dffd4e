package uk.gegc.xpeconomy.features.monitoring.application;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record ReconciliationSummary(
        int accountsChecked,
        int consistentAccounts,
        List<ReconciliationResult> violations,
        List<UUID> failedAccounts,
        LocalDateTime startedAt,
        LocalDateTime finishedAt
) {}

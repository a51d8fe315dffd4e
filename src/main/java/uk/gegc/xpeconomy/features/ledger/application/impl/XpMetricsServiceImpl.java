package uk.gegc.xpeconomy.features.ledger.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.xpeconomy.features.ledger.application.XpMetricsService;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;

import java.util.UUID;

/**
 * Micrometer-backed XP metrics. Per-source counters are tagged rather than named individually.
 */
@Slf4j
@Service
public class XpMetricsServiceImpl implements XpMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter reconciliationSuccessCounter;
    private final Counter reconciliationDriftCounter;

    public XpMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.reconciliationSuccessCounter = Counter.builder("xp.reconciliation.success")
                .description("Accounts whose balances matched the ledger")
                .register(meterRegistry);
        this.reconciliationDriftCounter = Counter.builder("xp.reconciliation.drift")
                .description("Accounts whose balances drifted from the ledger")
                .register(meterRegistry);
    }

    @Override
    public void recordEarn(UUID accountId, XpTransactionSource source, long amount) {
        meterRegistry.counter("xp.earned", "source", source.name()).increment(amount);
        meterRegistry.counter("xp.transactions", "type", "EARN", "source", source.name()).increment();
    }

    @Override
    public void recordSpend(UUID accountId, XpTransactionSource source, long amount) {
        meterRegistry.counter("xp.spent", "source", source.name()).increment(amount);
        meterRegistry.counter("xp.transactions", "type", "SPEND", "source", source.name()).increment();
    }

    @Override
    public void recordSpendRejected(UUID accountId, XpTransactionSource source, long shortfall) {
        meterRegistry.counter("xp.spend.rejected", "source", source.name()).increment();
        log.debug("Spend rejected for account {} ({}), shortfall {}", accountId, source, shortfall);
    }

    @Override
    public void recordIdempotentReplay(XpTransactionSource source) {
        meterRegistry.counter("xp.ledger.replays", "source", source.name()).increment();
    }

    @Override
    public void recordConflictRetry(String operation) {
        meterRegistry.counter("xp.ledger.conflicts", "operation", operation, "outcome", "retried").increment();
    }

    @Override
    public void recordConflictExhausted(String operation) {
        meterRegistry.counter("xp.ledger.conflicts", "operation", operation, "outcome", "exhausted").increment();
    }

    @Override
    public void recordReconciliationSuccess(UUID accountId) {
        reconciliationSuccessCounter.increment();
    }

    @Override
    public void recordReconciliationDrift(UUID accountId, long driftAmount) {
        reconciliationDriftCounter.increment();
        log.warn("Reconciliation drift for account {}: {}", accountId, driftAmount);
    }

    @Override
    public void recordReviewFlag(UUID accountId, String flagType) {
        meterRegistry.counter("xp.monitoring.flags", "type", flagType).increment();
    }
}

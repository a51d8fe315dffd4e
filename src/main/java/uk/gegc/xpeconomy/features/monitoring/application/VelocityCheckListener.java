package uk.gegc.xpeconomy.features.monitoring.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.xpeconomy.features.ledger.domain.event.XpTransactionRecordedEvent;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

/**
 * Runs the velocity check off the request thread once an EARN entry is committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VelocityCheckListener {

    private final XpMonitoringService monitoringService;

    @Async("monitoringTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTransactionRecorded(XpTransactionRecordedEvent event) {
        if (event.getType() != XpTransactionType.EARN) {
            return;
        }
        log.debug("Velocity check for account {} after transaction {}", event.getAccountId(), event.getTransactionId());
        monitoringService.checkVelocity(event.getAccountId());
    }
}

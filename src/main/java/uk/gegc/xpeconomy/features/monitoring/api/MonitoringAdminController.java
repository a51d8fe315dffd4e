package uk.gegc.xpeconomy.features.monitoring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AccountReviewFlagDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AnomalyDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.EconomyMetricsDto;
import uk.gegc.xpeconomy.features.monitoring.api.dto.UnfreezeAccountRequest;
import uk.gegc.xpeconomy.features.monitoring.application.ReconciliationResult;
import uk.gegc.xpeconomy.features.monitoring.application.ReconciliationSummary;
import uk.gegc.xpeconomy.features.monitoring.application.XpMonitoringService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/monitoring")
@RequiredArgsConstructor
@Validated
@Tag(name = "Monitoring (Admin)", description = "Ledger reconciliation, review flags and economy health")
public class MonitoringAdminController {

    private final XpMonitoringService monitoringService;

    @Operation(summary = "Reconcile every account", description = "Runs the nightly check on demand")
    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationSummary> reconcileAll() {
        return ResponseEntity.ok(monitoringService.reconcileAllAccounts());
    }

    @Operation(summary = "Reconcile one account")
    @GetMapping("/reconciliation/{accountId}")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable UUID accountId) {
        return ResponseEntity.ok(monitoringService.reconcileAccount(accountId));
    }

    @Operation(summary = "Open review flags")
    @GetMapping("/flags")
    public ResponseEntity<List<AccountReviewFlagDto>> openFlags(
            @Parameter(description = "Only flags for this account") @RequestParam(required = false) UUID accountId) {
        return ResponseEntity.ok(monitoringService.listOpenFlags(accountId));
    }

    @Operation(summary = "Unfreeze an account", description = "Resolves its open flags and lifts the spending freeze")
    @PostMapping("/accounts/{accountId}/unfreeze")
    public ResponseEntity<AccountDto> unfreeze(@PathVariable UUID accountId,
                                               @Valid @RequestBody UnfreezeAccountRequest request) {
        return ResponseEntity.ok(monitoringService.unfreeze(accountId, request.note()));
    }

    @Operation(summary = "XP economy metrics")
    @GetMapping("/economy")
    public ResponseEntity<EconomyMetricsDto> economy() {
        return ResponseEntity.ok(monitoringService.getEconomyMetrics());
    }

    @Operation(summary = "Detect anomalies", description = "Negative balances, very high balances and large recent transactions")
    @GetMapping("/anomalies")
    public ResponseEntity<List<AnomalyDto>> anomalies() {
        return ResponseEntity.ok(monitoringService.detectAnomalies());
    }
}

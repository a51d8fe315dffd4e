package uk.gegc.xpeconomy.features.ledger.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.xpeconomy.features.ledger.api.dto.*;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}")
@RequiredArgsConstructor
@Validated
@Tag(name = "Ledger", description = "XP balances, history and direct earn/spend operations")
public class LedgerController {

    private final LedgerService ledgerService;

    @Operation(summary = "Get balances", description = "Returns accumulated and spendable XP")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balances retrieved",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "404", description = "Account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(@PathVariable UUID accountId) {
        return ResponseEntity.ok(ledgerService.getBalance(accountId));
    }

    @Operation(summary = "List ledger entries", description = "Newest first, filterable by type, source and date range")
    @GetMapping("/transactions")
    public ResponseEntity<Page<XpTransactionDto>> listTransactions(
            @PathVariable UUID accountId,
            @Parameter(description = "EARN or SPEND") @RequestParam(required = false) XpTransactionType type,
            @Parameter(description = "Transaction category") @RequestParam(required = false) XpTransactionSource source,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo,
            @PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(ledgerService.listTransactions(accountId, type, source, dateFrom, dateTo, pageable));
    }

    @Operation(summary = "Derived balances", description = "Balances recomputed from the ledger alongside the stored ones")
    @GetMapping("/balance/derived")
    public ResponseEntity<DerivedBalanceDto> getDerivedBalance(@PathVariable UUID accountId) {
        return ResponseEntity.ok(ledgerService.getDerivedBalance(accountId));
    }

    @Operation(summary = "Earn XP", description = "Credits both currencies. Replaying a requestId returns the original entry.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Entry written",
                    content = @Content(schema = @Schema(implementation = XpTransactionDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount or category",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Request id reused for a different operation",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Account contended, retry later",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/xp/earn")
    public ResponseEntity<XpTransactionDto> earn(@PathVariable UUID accountId,
                                                 @Valid @RequestBody EarnXpRequest request) {
        XpTransactionDto tx = ledgerService.earn(accountId, request.amount(), request.source(),
                request.description(), TransactionRefs.request(request.requestId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }

    @Operation(summary = "Spend XP", description = "Debits spendable XP; fails without side effects when the balance is short")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Entry written",
                    content = @Content(schema = @Schema(implementation = XpTransactionDto.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient spendable XP",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "423", description = "Spending frozen pending review",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/xp/spend")
    public ResponseEntity<XpTransactionDto> spend(@PathVariable UUID accountId,
                                                  @Valid @RequestBody SpendXpRequest request) {
        XpTransactionDto tx = ledgerService.spend(accountId, request.amount(), request.purpose(),
                request.description(), TransactionRefs.request(request.requestId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }
}

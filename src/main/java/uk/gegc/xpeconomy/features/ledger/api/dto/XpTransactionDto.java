package uk.gegc.xpeconomy.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "XpTransactionDto", description = "One ledger entry")
public record XpTransactionDto(
        UUID id,
        UUID accountId,
        long sequenceNo,
        XpTransactionType type,
        XpTransactionSource source,

        @Schema(description = "Signed amount, negative for spends", example = "-30")
        long amount,

        String description,

        @Schema(description = "Spendable balance right after this entry", example = "10")
        long balanceAfter,

        long accumulatedAfter,
        UUID quizAttemptId,
        String commentRef,
        String featureRef,
        String idempotencyKey,
        LocalDateTime createdAt
) {}

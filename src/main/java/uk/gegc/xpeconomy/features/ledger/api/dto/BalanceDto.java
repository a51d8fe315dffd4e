package uk.gegc.xpeconomy.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "BalanceDto", description = "Both XP currencies of an account")
public record BalanceDto(
        UUID accountId,

        @Schema(description = "Lifetime XP earned", example = "1520")
        long accumulatedXp,

        @Schema(description = "XP available to spend", example = "340")
        long spendableXp
) {}

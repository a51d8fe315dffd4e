package uk.gegc.xpeconomy.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;

@Schema(name = "EarnXpRequest", description = "Credit XP to an account")
public record EarnXpRequest(
        @Positive
        long amount,

        @NotNull
        @Schema(description = "Earning category", example = "ADMIN_ADJUSTMENT")
        XpTransactionSource source,

        @Size(max = 255)
        String description,

        @Schema(description = "Client request id, replays return the original entry")
        @Size(max = 200)
        String requestId
) {}

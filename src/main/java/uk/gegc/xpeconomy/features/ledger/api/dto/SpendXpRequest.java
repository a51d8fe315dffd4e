package uk.gegc.xpeconomy.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;

@Schema(name = "SpendXpRequest", description = "Debit spendable XP from an account")
public record SpendXpRequest(
        @Positive
        long amount,

        @NotNull
        @Schema(description = "Spending purpose", example = "FEATURE_PURCHASE")
        XpTransactionSource purpose,

        @Size(max = 255)
        String description,

        @Size(max = 200)
        String requestId
) {}

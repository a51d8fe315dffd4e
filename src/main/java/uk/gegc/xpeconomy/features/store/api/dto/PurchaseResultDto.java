package uk.gegc.xpeconomy.features.store.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "PurchaseResultDto", description = "Outcome of a feature or bundle purchase")
public record PurchaseResultDto(
        UUID accountId,
        @Schema(description = "Features granted by this purchase") List<FeaturePurchaseDto> granted,
        long xpCharged,
        UUID transactionId,
        long spendableXp
) {}

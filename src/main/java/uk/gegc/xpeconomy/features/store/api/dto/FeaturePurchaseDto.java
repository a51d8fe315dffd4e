package uk.gegc.xpeconomy.features.store.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record FeaturePurchaseDto(
        UUID id,
        UUID accountId,
        String featureId,
        long costPaid,
        UUID transactionId,
        String bundleId,
        LocalDateTime purchasedAt
) {}

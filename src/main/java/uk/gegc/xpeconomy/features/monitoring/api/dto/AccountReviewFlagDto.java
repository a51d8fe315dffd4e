package uk.gegc.xpeconomy.features.monitoring.api.dto;

import uk.gegc.xpeconomy.features.monitoring.domain.model.ReviewFlagType;

import java.time.LocalDateTime;
import java.util.UUID;

public record AccountReviewFlagDto(
        UUID id,
        UUID accountId,
        ReviewFlagType flagType,
        long observedValue,
        long expectedValue,
        String details,
        boolean spendingFrozen,
        boolean resolved,
        String resolutionNote,
        LocalDateTime resolvedAt,
        LocalDateTime createdAt
) {}

package uk.gegc.xpeconomy.features.monitoring.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(name = "EconomyMetricsDto", description = "XP flow across all accounts since a point in time")
public record EconomyMetricsDto(
        LocalDateTime since,
        long transactions,
        long xpEarned,
        long xpSpent,
        long netFlow,
        long activeAccounts,
        long featurePurchases,
        long frozenAccounts,
        long openFlags,
        @Schema(description = "HEALTHY when more XP was earned than spent, DEFLATION otherwise")
        String health
) {}

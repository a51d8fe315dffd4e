package uk.gegc.xpeconomy.features.reward.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "RewardResultDto", description = "XP awarded for an attempt with its breakdown")
public record RewardResultDto(
        @Schema(example = "1000")
        long xpAwarded,
        boolean passed,
        boolean perfect,
        BigDecimal complexityFactor,
        BigDecimal speedMultiplier,
        BigDecimal accuracyBonus,
        BigDecimal rawXp,
        BigDecimal perfectBonus,
        BigDecimal diminishingFactor
) {}

package uk.gegc.xpeconomy.features.reward.domain.model;

import java.math.BigDecimal;

/**
 * Outcome of one reward calculation with every intermediate factor kept for display and audit.
 * For a failed attempt all factors are zero.
 */
public record RewardResult(
        long xpAwarded,
        boolean passed,
        boolean perfect,
        BigDecimal complexityFactor,
        BigDecimal speedMultiplier,
        BigDecimal accuracyBonus,
        BigDecimal rawXp,
        BigDecimal perfectBonus,
        BigDecimal diminishingFactor
) {

    public static RewardResult failed() {
        return new RewardResult(0L, false, false,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}

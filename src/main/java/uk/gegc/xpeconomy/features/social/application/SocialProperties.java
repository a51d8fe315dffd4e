package uk.gegc.xpeconomy.features.social.application;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * XP prices of social actions. Report tiers share the price of the positive tier with the same severity.
 */
@Configuration
@ConfigurationProperties(prefix = "xp.social")
@Validated
@Data
public class SocialProperties {

    @PositiveOrZero
    private long commentCost = 100L;

    @PositiveOrZero
    private long replyCost = 50L;

    @PositiveOrZero
    private long bronzeCost = 5L;

    @PositiveOrZero
    private long silverCost = 15L;

    @PositiveOrZero
    private long goldCost = 30L;

    /**
     * Share of a positive interaction's price credited to the comment author (floored).
     */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal authorRewardRate = new BigDecimal("0.5");

    /**
     * Delay between sweeps that finish author rewards left pending by a failure after the actor was charged.
     */
    private long pendingRewardSweepMillis = 60_000L;

    public long costFor(InteractionTier tier) {
        return switch (tier.getSeverity()) {
            case 1 -> bronzeCost;
            case 2 -> silverCost;
            default -> goldCost;
        };
    }

    public long commentCostFor(boolean reply) {
        return reply ? replyCost : commentCost;
    }

    public long authorRewardFor(long cost) {
        return BigDecimal.valueOf(cost).multiply(authorRewardRate).setScale(0, RoundingMode.FLOOR).longValueExact();
    }
}

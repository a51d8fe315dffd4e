package uk.gegc.xpeconomy.features.progression.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Reading speed ratchet settings.
 */
@Configuration
@ConfigurationProperties(prefix = "xp.progression")
@Validated
@Data
public class ProgressionProperties {

    @Positive
    private int initialCurrentWpm = 200;

    @Positive
    private int initialMaxWpm = 225;

    /**
     * How far {@code maxWpm} moves on each unlock.
     */
    @Positive
    private int wpmStep = 25;

    /**
     * XP credited on each unlock, separate from the quiz reward.
     */
    @Positive
    private long bonusXp = 50L;

    /**
     * Speed taken off the recommendation for each failed quiz since the last pass.
     */
    @Positive
    private int recommendationStep = 25;

    @Positive
    private int maxRecommendationReduction = 100;

    @Positive
    private int minRecommendedWpm = 100;
}

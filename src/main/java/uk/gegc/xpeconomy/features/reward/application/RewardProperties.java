package uk.gegc.xpeconomy.features.reward.application;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.xpeconomy.features.reward.domain.model.LengthMetric;

@Configuration
@ConfigurationProperties(prefix = "xp.reward")
@Validated
@Data
public class RewardProperties {

    /**
     * Content size used as the reward base for this deployment.
     */
    @NotNull
    private LengthMetric lengthMetric = LengthMetric.WORDS;
}

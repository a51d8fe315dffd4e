package uk.gegc.xpeconomy.features.monitoring.application;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "xp.monitoring")
@Validated
@Data
public class MonitoringProperties {

    @NotBlank
    private String reconciliationCron = "0 0 3 * * *";

    @NotNull
    private Duration velocityWindow = Duration.ofHours(1);

    @Positive
    private long velocityThreshold = 5000L;

    /**
     * Freeze spending on reconciliation violations.
     */
    private boolean freezeOnViolation = true;

    /**
     * Freeze spending when the velocity limit is exceeded. Off by default: fast earners are usually legitimate.
     */
    private boolean freezeOnVelocity = false;

    @Positive
    private long highBalanceThreshold = 100_000L;

    @Positive
    private long largeTransactionThreshold = 5000L;

    @NotNull
    private Duration anomalyWindow = Duration.ofHours(1);

    @NotNull
    private Duration economyMetricsWindow = Duration.ofDays(1);
}

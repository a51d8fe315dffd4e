package uk.gegc.xpeconomy.features.ledger.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger write settings (contention handling).
 */
@Configuration
@ConfigurationProperties(prefix = "xp.ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Total tries for one mutation when the account row or an idempotency key is contended.
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Base pause between tries; the n-th retry waits n times this.
     */
    @PositiveOrZero
    private long retryBackoffMillis = 20L;

    /**
     * Value sent in the Retry-After header once retries are exhausted.
     */
    @Positive
    private long retryAfterSeconds = 1L;
}

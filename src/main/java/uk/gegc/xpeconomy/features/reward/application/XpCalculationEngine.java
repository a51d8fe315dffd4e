package uk.gegc.xpeconomy.features.reward.application;

import org.springframework.stereotype.Component;
import uk.gegc.xpeconomy.features.reward.domain.model.RewardResult;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Computes the XP earned for one quiz attempt. Pure: no I/O, no state.
 * <p>
 * All factors are exact decimals (every divisor is a product of 2s and 5s), so the only rounding
 * is the final floor. Halving the floored value with a right shift gives the same result as
 * dividing first, so {@code reward(k + 1) == floor(reward(k) / 2)} for retries.
 * Once the shift count reaches the bit length of the undiminished reward, the attempt is worth 0.
 */
@Component
public class XpCalculationEngine {

    public static final int PASS_THRESHOLD = 60;
    public static final int PERFECT_SCORE = 100;

    private static final BigDecimal BASELINE_WPM = BigDecimal.valueOf(250);
    private static final BigDecimal TEN = BigDecimal.TEN;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal PERFECT_BONUS_RATE = new BigDecimal("0.25");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Decimal places kept for the reported diminishing factor; {@code 0.5^n} is exact up to n = 20.
     */
    static final int DIMINISHING_FACTOR_SCALE = 20;

    /**
     * From 68 halvings on, {@code 0.5^n < 0.5e-20} and the reported factor rounds to 0.
     */
    private static final int MAX_REPORTED_HALVINGS = 67;

    public RewardResult calculate(long lengthMetric, BigDecimal readingLevel, int scorePct, int wpmUsed,
                                  int attemptNumber) {
        validate(lengthMetric, readingLevel, scorePct, wpmUsed, attemptNumber);

        if (scorePct < PASS_THRESHOLD) {
            return RewardResult.failed();
        }

        BigDecimal complexityFactor = readingLevel.divide(TEN);
        BigDecimal speedMultiplier = BigDecimal.valueOf(wpmUsed).divide(BASELINE_WPM).multiply(complexityFactor);
        BigDecimal accuracyBonus = BigDecimal.valueOf(scorePct).divide(HUNDRED);
        BigDecimal raw = BigDecimal.valueOf(lengthMetric).multiply(speedMultiplier).multiply(accuracyBonus);
        boolean perfect = scorePct == PERFECT_SCORE;
        BigDecimal perfectBonus = perfect ? raw.multiply(PERFECT_BONUS_RATE) : BigDecimal.ZERO;

        int halvings = attemptNumber - 1;
        BigInteger undiminished = raw.add(perfectBonus).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
        long total = halvings >= undiminished.bitLength()
                ? 0L
                : undiminished.shiftRight(halvings).longValueExact();

        return new RewardResult(
                total,
                true,
                perfect,
                complexityFactor.stripTrailingZeros(),
                speedMultiplier.stripTrailingZeros(),
                accuracyBonus.stripTrailingZeros(),
                raw.stripTrailingZeros(),
                perfectBonus.stripTrailingZeros(),
                diminishingFactor(halvings)
        );
    }

    /**
     * {@code 0.5^halvings} rounded to {@value #DIMINISHING_FACTOR_SCALE} places.
     */
    static BigDecimal diminishingFactor(int halvings) {
        if (halvings > MAX_REPORTED_HALVINGS) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.ONE.divide(TWO.pow(halvings))
                .setScale(DIMINISHING_FACTOR_SCALE, RoundingMode.HALF_EVEN)
                .stripTrailingZeros();
    }

    public RewardResult calculate(long lengthMetric, double readingLevel, int scorePct, int wpmUsed,
                                  int attemptNumber) {
        return calculate(lengthMetric, BigDecimal.valueOf(readingLevel), scorePct, wpmUsed, attemptNumber);
    }

    private void validate(long lengthMetric, BigDecimal readingLevel, int scorePct, int wpmUsed, int attemptNumber) {
        if (lengthMetric < 0) {
            throw new XpValidationException("lengthMetric must be >= 0");
        }
        if (readingLevel == null || readingLevel.signum() < 0) {
            throw new XpValidationException("readingLevel must be >= 0");
        }
        if (scorePct < 0 || scorePct > PERFECT_SCORE) {
            throw new XpValidationException("scorePct must be between 0 and 100");
        }
        if (wpmUsed <= 0) {
            throw new XpValidationException("wpmUsed must be > 0");
        }
        if (attemptNumber < 1) {
            throw new XpValidationException("attemptNumber must be >= 1");
        }
    }
}

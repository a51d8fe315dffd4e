package uk.gegc.xpeconomy.features.reward.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.xpeconomy.features.reward.domain.model.RewardResult;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

@DisplayName("XpCalculationEngine")
class XpCalculationEngineTest {

    private final XpCalculationEngine engine = new XpCalculationEngine();

    @Nested
    @DisplayName("Reward formula")
    class Formula {

        @Test
        @DisplayName("perfect first attempt at baseline speed: 1000 words, level 8 -> 1000 XP")
        void perfectFirstAttempt() {
            RewardResult result = engine.calculate(1000, new BigDecimal("8.0"), 100, 250, 1);

            assertThat(result.xpAwarded()).isEqualTo(1000);
            assertThat(result.passed()).isTrue();
            assertThat(result.perfect()).isTrue();
            assertThat(result.complexityFactor()).isEqualByComparingTo("0.8");
            assertThat(result.speedMultiplier()).isEqualByComparingTo("0.8");
            assertThat(result.accuracyBonus()).isEqualByComparingTo("1");
            assertThat(result.rawXp()).isEqualByComparingTo("800");
            assertThat(result.perfectBonus()).isEqualByComparingTo("200");
            assertThat(result.diminishingFactor()).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("score below the pass mark earns nothing")
        void failedAttempt() {
            RewardResult result = engine.calculate(1000, new BigDecimal("8.0"), 50, 250, 1);

            assertThat(result.xpAwarded()).isZero();
            assertThat(result.passed()).isFalse();
            assertThat(result.perfect()).isFalse();
        }

        @Test
        @DisplayName("exactly 60% passes without a perfect bonus")
        void passMarkIsInclusive() {
            RewardResult result = engine.calculate(1000, new BigDecimal("10"), 60, 250, 1);

            assertThat(result.passed()).isTrue();
            assertThat(result.perfect()).isFalse();
            assertThat(result.xpAwarded()).isEqualTo(600);
        }

        @Test
        @DisplayName("result is floored, never rounded up")
        void resultIsFloored() {
            // 7 * (250/250 * 0.5) * 0.99 = 3.465
            RewardResult result = engine.calculate(7, new BigDecimal("5"), 99, 250, 1);

            assertThat(result.xpAwarded()).isEqualTo(3);
        }

        @Test
        @DisplayName("zero-length content passes with zero XP")
        void zeroLength() {
            RewardResult result = engine.calculate(0, new BigDecimal("8"), 100, 250, 1);

            assertThat(result.passed()).isTrue();
            assertThat(result.xpAwarded()).isZero();
        }

        @Test
        @DisplayName("double overload gives the same answer as the decimal one")
        void doubleOverload() {
            assertThat(engine.calculate(1000, 8.0, 100, 250, 1).xpAwarded())
                    .isEqualTo(engine.calculate(1000, new BigDecimal("8.0"), 100, 250, 1).xpAwarded());
        }
    }

    @Nested
    @DisplayName("Diminishing returns")
    class Diminishing {

        @ParameterizedTest(name = "attempt {0} -> {1} XP")
        @CsvSource({"1, 1000", "2, 500", "3, 250", "4, 125", "5, 62", "6, 31"})
        @DisplayName("each retry halves the reward")
        void halvesPerAttempt(int attempt, long expected) {
            assertThat(engine.calculate(1000, new BigDecimal("8.0"), 100, 250, attempt).xpAwarded())
                    .isEqualTo(expected);
        }

        @Test
        @DisplayName("reward(k + 1) == floor(reward(k) / 2) across odd intermediate values")
        void nextAttemptIsHalfOfPrevious() {
            for (int attempt = 1; attempt < 12; attempt++) {
                long current = engine.calculate(1337, new BigDecimal("7.3"), 87, 310, attempt).xpAwarded();
                long next = engine.calculate(1337, new BigDecimal("7.3"), 87, 310, attempt + 1).xpAwarded();
                assertThat(next).as("attempt %d", attempt + 1).isEqualTo(current / 2);
            }
        }

        @Test
        @DisplayName("very late attempts reach zero without failing")
        void lateAttemptsReachZero() {
            assertThat(engine.calculate(1000, new BigDecimal("8.0"), 100, 250, 40).xpAwarded()).isZero();
        }

        @Test
        @DisplayName("last non-zero retry is the one whose shift leaves a single bit")
        void lastNonZeroAttempt() {
            // 1000 XP undiminished: 10 bits
            assertThat(engine.calculate(1000, new BigDecimal("8.0"), 100, 250, 10).xpAwarded()).isEqualTo(1);
            assertThat(engine.calculate(1000, new BigDecimal("8.0"), 100, 250, 11).xpAwarded()).isZero();
        }

        @Test
        @DisplayName("huge attempt numbers return zero promptly instead of throwing")
        void hugeAttemptNumbers() {
            RewardResult result = assertTimeoutPreemptively(Duration.ofSeconds(1),
                    () -> engine.calculate(1000, 8.0, 100, 250, Integer.MAX_VALUE));

            assertThat(result.xpAwarded()).isZero();
            assertThat(result.passed()).isTrue();
            assertThat(result.diminishingFactor()).isEqualByComparingTo("0");

            assertThat(assertTimeoutPreemptively(Duration.ofSeconds(1),
                    () -> engine.calculate(1000, 8.0, 100, 250, 200_000)).xpAwarded()).isZero();
        }

        @ParameterizedTest(name = "attempt {0} -> factor {1}")
        @CsvSource({"1, 1", "2, 0.5", "3, 0.25", "11, 0.0009765625", "21, 0.00000095367431640625"})
        @DisplayName("diminishing factor is reported as 0.5^(attempt - 1)")
        void reportedFactor(int attempt, String expected) {
            assertThat(engine.calculate(1000, 8.0, 100, 250, attempt).diminishingFactor())
                    .isEqualByComparingTo(expected);
        }
    }

    @Nested
    @DisplayName("Input validation")
    class Validation {

        @Test
        void negativeLength() {
            assertThatThrownBy(() -> engine.calculate(-1, BigDecimal.ONE, 80, 250, 1))
                    .isInstanceOf(XpValidationException.class);
        }

        @Test
        void negativeReadingLevel() {
            assertThatThrownBy(() -> engine.calculate(10, new BigDecimal("-0.5"), 80, 250, 1))
                    .isInstanceOf(XpValidationException.class);
        }

        @Test
        void scoreOutOfRange() {
            assertThatThrownBy(() -> engine.calculate(10, BigDecimal.ONE, 101, 250, 1))
                    .isInstanceOf(XpValidationException.class);
            assertThatThrownBy(() -> engine.calculate(10, BigDecimal.ONE, -1, 250, 1))
                    .isInstanceOf(XpValidationException.class);
        }

        @Test
        void nonPositiveWpm() {
            assertThatThrownBy(() -> engine.calculate(10, BigDecimal.ONE, 80, 0, 1))
                    .isInstanceOf(XpValidationException.class)
                    .hasMessageContaining("wpmUsed");
        }

        @Test
        void attemptNumberStartsAtOne() {
            assertThatThrownBy(() -> engine.calculate(10, BigDecimal.ONE, 80, 250, 0))
                    .isInstanceOf(XpValidationException.class)
                    .hasMessageContaining("attemptNumber");
        }
    }
}

package uk.gegc.xpeconomy.features.reward.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

@Schema(name = "CalculateRewardRequest", description = "Inputs for a reward preview")
public record CalculateRewardRequest(
        @PositiveOrZero
        @Schema(example = "1000")
        long lengthMetric,

        @NotNull
        @DecimalMin("0.0")
        @Schema(example = "8.0")
        BigDecimal readingLevel,

        @Min(0)
        @Max(100)
        @Schema(example = "100")
        int scorePct,

        @Positive
        @Schema(example = "250")
        int wpmUsed,

        @Min(1)
        @Schema(example = "1")
        int attemptNumber
) {}

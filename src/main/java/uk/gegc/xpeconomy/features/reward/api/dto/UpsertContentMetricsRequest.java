package uk.gegc.xpeconomy.features.reward.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

@Schema(name = "UpsertContentMetricsRequest", description = "Size and difficulty of a content item")
public record UpsertContentMetricsRequest(
        @PositiveOrZero
        long wordCount,

        @PositiveOrZero
        long letterCount,

        @NotNull
        @DecimalMin("0.0")
        @Schema(description = "Numeric complexity score, e.g. a grade level", example = "8.0")
        BigDecimal readingLevel
) {}

package uk.gegc.xpeconomy.features.progression.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;

@Schema(name = "UpdateReadingSpeedRequest")
public record UpdateReadingSpeedRequest(
        @Positive
        @Schema(description = "New current speed, at most the unlocked maximum", example = "225")
        int currentWpm
) {}

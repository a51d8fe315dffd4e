package uk.gegc.xpeconomy.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "RecordQuizAttemptRequest", description = "Graded quiz result reported by the grading subsystem")
public record RecordQuizAttemptRequest(
        @NotBlank
        @Size(max = 100)
        String contentId,

        @Min(0)
        @Max(100)
        @Schema(example = "100")
        int scorePct,

        @Positive
        @Schema(example = "225")
        int wpmUsed,

        @Size(max = 200)
        @Schema(description = "Grading submission id, replays return the stored attempt")
        String requestId
) {}

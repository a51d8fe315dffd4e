package uk.gegc.xpeconomy.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptDto;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptOutcomeDto;
import uk.gegc.xpeconomy.features.attempt.api.dto.RecordQuizAttemptRequest;
import uk.gegc.xpeconomy.features.attempt.application.QuizAttemptService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/quiz-attempts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Quiz Attempts", description = "Graded quiz results and the XP they earn")
public class QuizAttemptController {

    private final QuizAttemptService quizAttemptService;

    @Operation(summary = "Record a graded quiz attempt",
            description = "Computes the reward from the attempt history, credits it and applies any reading speed unlock")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt recorded",
                    content = @Content(schema = @Schema(implementation = QuizAttemptOutcomeDto.class))),
            @ApiResponse(responseCode = "200", description = "Request id already processed, stored attempt returned",
                    content = @Content(schema = @Schema(implementation = QuizAttemptOutcomeDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid score or speed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown account or content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<QuizAttemptOutcomeDto> record(@PathVariable UUID accountId,
                                                        @Valid @RequestBody RecordQuizAttemptRequest request) {
        QuizAttemptOutcomeDto outcome = quizAttemptService.recordQuizAttempt(
                accountId, request.contentId(), request.scorePct(), request.wpmUsed(), request.requestId());
        return ResponseEntity.status(outcome.replayed() ? HttpStatus.OK : HttpStatus.CREATED).body(outcome);
    }

    @Operation(summary = "List quiz attempts", description = "All attempts on one content item, or the 50 most recent overall")
    @GetMapping
    public ResponseEntity<List<QuizAttemptDto>> list(
            @PathVariable UUID accountId,
            @Parameter(description = "Restrict to one content item") @RequestParam(required = false) String contentId) {
        return ResponseEntity.ok(quizAttemptService.listAttempts(accountId, contentId));
    }
}

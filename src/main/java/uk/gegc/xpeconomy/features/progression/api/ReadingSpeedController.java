package uk.gegc.xpeconomy.features.progression.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.xpeconomy.features.progression.api.dto.ReadingSpeedDto;
import uk.gegc.xpeconomy.features.progression.api.dto.UpdateReadingSpeedRequest;
import uk.gegc.xpeconomy.features.progression.application.SpeedProgressionService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/reading-speed")
@RequiredArgsConstructor
@Validated
@Tag(name = "Reading Speed", description = "Current and unlocked reading speeds")
public class ReadingSpeedController {

    private final SpeedProgressionService progressionService;

    @Operation(summary = "Get reading speed")
    @GetMapping
    public ResponseEntity<ReadingSpeedDto> get(@PathVariable UUID accountId) {
        return ResponseEntity.ok(progressionService.getReadingSpeed(accountId));
    }

    @Operation(summary = "Change current reading speed", description = "Free; limited to the unlocked maximum")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Speed updated",
                    content = @Content(schema = @Schema(implementation = ReadingSpeedDto.class))),
            @ApiResponse(responseCode = "400", description = "Speed above the unlocked maximum",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping
    public ResponseEntity<ReadingSpeedDto> update(@PathVariable UUID accountId,
                                                  @Valid @RequestBody UpdateReadingSpeedRequest request) {
        return ResponseEntity.ok(progressionService.setCurrentWpm(accountId, request.currentWpm()));
    }
}

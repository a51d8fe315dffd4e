package uk.gegc.xpeconomy.features.reward.api;

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
import uk.gegc.xpeconomy.features.reward.api.dto.*;
import uk.gegc.xpeconomy.features.reward.application.ContentMetricsService;
import uk.gegc.xpeconomy.features.reward.application.XpCalculationEngine;
import uk.gegc.xpeconomy.features.reward.infra.mapping.RewardMapper;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Rewards", description = "Reward calculation and content metrics")
public class RewardController {

    private final XpCalculationEngine calculationEngine;
    private final ContentMetricsService contentMetricsService;
    private final RewardMapper rewardMapper;

    @Operation(summary = "Preview a reward", description = "Runs the reward formula without touching any balance")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reward computed",
                    content = @Content(schema = @Schema(implementation = RewardResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid inputs",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/rewards/calculate")
    public ResponseEntity<RewardResultDto> calculate(@Valid @RequestBody CalculateRewardRequest request) {
        var result = calculationEngine.calculate(request.lengthMetric(), request.readingLevel(),
                request.scorePct(), request.wpmUsed(), request.attemptNumber());
        return ResponseEntity.ok(rewardMapper.toDto(result));
    }

    @Operation(summary = "Register content metrics", description = "Called by the content subsystem when an item is published or re-analysed")
    @PutMapping("/content/{contentId}/metrics")
    public ResponseEntity<ContentMetricsDto> upsertMetrics(@PathVariable String contentId,
                                                           @Valid @RequestBody UpsertContentMetricsRequest request) {
        return ResponseEntity.ok(contentMetricsService.upsert(contentId, request));
    }

    @Operation(summary = "Get content metrics")
    @GetMapping("/content/{contentId}/metrics")
    public ResponseEntity<ContentMetricsDto> getMetrics(@PathVariable String contentId) {
        return ResponseEntity.ok(contentMetricsService.get(contentId));
    }
}

package uk.gegc.xpeconomy.features.social.api;

import io.swagger.v3.oas.annotations.Operation;
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
import uk.gegc.xpeconomy.features.social.api.dto.*;
import uk.gegc.xpeconomy.features.social.application.SocialInteractionService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Social", description = "XP charges for comments and comment interactions")
public class SocialController {

    private final SocialInteractionService socialService;

    @Operation(summary = "Authorize a comment",
            description = "Requires a passed quiz on the content. Uses a perfect-score credit if one is available, otherwise charges XP.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Comment authorized",
                    content = @Content(schema = @Schema(implementation = CommentChargeDto.class))),
            @ApiResponse(responseCode = "403", description = "Quiz not passed on this content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient spendable XP",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/social/comments")
    public ResponseEntity<CommentChargeDto> authorizeComment(@Valid @RequestBody AuthorizeCommentRequest request) {
        CommentChargeDto charge = socialService.authorizeComment(request.accountId(), request.contentId(),
                request.commentRef(), request.reply(), request.requestId());
        return ResponseEntity.status(HttpStatus.CREATED).body(charge);
    }

    @Operation(summary = "Quote a comment", description = "Cost and eligibility without charging anything")
    @GetMapping("/accounts/{accountId}/social/comment-quote")
    public ResponseEntity<CommentQuoteDto> quoteComment(@PathVariable UUID accountId,
                                                        @RequestParam String contentId,
                                                        @RequestParam(defaultValue = "false") boolean reply) {
        return ResponseEntity.ok(socialService.quoteComment(accountId, contentId, reply));
    }

    @Operation(summary = "Record an interaction",
            description = "Charges the actor, then credits the author's share for positive tiers")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Interaction recorded",
                    content = @Content(schema = @Schema(implementation = CommentInteractionDto.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient XP or tier already given on this comment",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/social/interactions")
    public ResponseEntity<CommentInteractionDto> interact(@Valid @RequestBody InteractionRequest request) {
        CommentInteractionDto interaction = socialService.interact(request.actorId(), request.authorId(),
                request.commentRef(), request.tier(), request.requestId());
        return ResponseEntity.status(HttpStatus.CREATED).body(interaction);
    }

    @Operation(summary = "Current social prices")
    @GetMapping("/social/costs")
    public ResponseEntity<SocialCostsDto> getCosts() {
        return ResponseEntity.ok(socialService.getCosts());
    }

    @Operation(summary = "Social activity summary")
    @GetMapping("/accounts/{accountId}/social-summary")
    public ResponseEntity<SocialSummaryDto> getSummary(@PathVariable UUID accountId) {
        return ResponseEntity.ok(socialService.getSummary(accountId));
    }
}

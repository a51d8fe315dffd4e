package uk.gegc.xpeconomy.features.social.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "AuthorizeCommentRequest", description = "Comment creation event raised by the comment subsystem")
public record AuthorizeCommentRequest(
        @NotNull
        UUID accountId,

        @NotBlank
        @Size(max = 100)
        String contentId,

        @Size(max = 100)
        @Schema(description = "Comment id in the comment subsystem, if already assigned")
        String commentRef,

        @Schema(description = "True for a reply to another comment")
        boolean reply,

        @NotBlank
        @Size(max = 200)
        String requestId
) {}

package uk.gegc.xpeconomy.features.social.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.util.UUID;

@Schema(name = "InteractionRequest", description = "Interaction event raised by the comment subsystem")
public record InteractionRequest(
        @NotNull
        @Schema(description = "Account giving the interaction")
        UUID actorId,

        @NotNull
        @Schema(description = "Account that wrote the comment")
        UUID authorId,

        @NotBlank
        @Size(max = 100)
        String commentRef,

        @NotNull
        InteractionTier tier,

        @NotBlank
        @Size(max = 200)
        String requestId
) {}

package uk.gegc.xpeconomy.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "RegisterAccountRequest", description = "Opens an XP account for an externally authenticated user")
public record RegisterAccountRequest(
        @Schema(description = "Identity supplied by the authentication layer", example = "reader42")
        @NotBlank
        @Size(max = 100)
        String username
) {}

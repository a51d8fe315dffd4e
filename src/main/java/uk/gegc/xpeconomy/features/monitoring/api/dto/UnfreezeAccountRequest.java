package uk.gegc.xpeconomy.features.monitoring.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UnfreezeAccountRequest(
        @NotBlank
        @Size(max = 500)
        String note
) {}

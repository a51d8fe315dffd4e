package uk.gegc.xpeconomy.features.store.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record UpdateFeaturePriceRequest(
        @NotNull
        @Positive
        Long price
) {}

package uk.gegc.xpeconomy.features.store.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCategory;

import java.util.Set;

@Schema(name = "FeatureDto", description = "Catalog entry, with ownership flags when an account is given")
public record FeatureDto(
        String id,
        String displayName,
        String description,
        long price,
        FeatureCategory category,
        Set<String> prerequisites,
        @Schema(description = "Already bought by the account") boolean owned,
        @Schema(description = "Spendable XP covers the price") boolean affordable,
        @Schema(description = "Every prerequisite is owned") boolean prerequisitesMet
) {}

package uk.gegc.xpeconomy.features.store.api.dto;

import java.util.Set;

public record FeatureBundleDto(
        String id,
        String displayName,
        String description,
        long price,
        Set<String> featureIds
) {}

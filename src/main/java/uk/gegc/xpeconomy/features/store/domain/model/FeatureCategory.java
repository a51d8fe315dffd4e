package uk.gegc.xpeconomy.features.store.domain.model;

public enum FeatureCategory {
    FONTS,
    CHUNKING,
    SMART_FEATURES,
    THEMES
}

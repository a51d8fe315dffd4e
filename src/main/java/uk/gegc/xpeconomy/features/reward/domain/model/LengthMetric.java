package uk.gegc.xpeconomy.features.reward.domain.model;

/**
 * Which content size drives rewards. One value per deployment; the two are never mixed.
 */
public enum LengthMetric {
    WORDS,
    LETTERS
}

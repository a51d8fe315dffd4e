package uk.gegc.xpeconomy.features.progression.application;

import java.util.UUID;

/**
 * A speed unlock: the new maximum and the bonus entry written for it.
 */
public record ProgressionOutcome(int previousMaxWpm, int newMaxWpm, long bonusXp, UUID bonusTransactionId) {}

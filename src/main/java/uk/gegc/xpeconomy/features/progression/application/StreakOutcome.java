package uk.gegc.xpeconomy.features.progression.application;

import java.util.UUID;

/**
 * A day counted towards the reading streak. {@code bonusTransactionId} is null below the first bonus tier.
 */
public record StreakOutcome(int streakDays, long bonusXp, UUID bonusTransactionId) {}

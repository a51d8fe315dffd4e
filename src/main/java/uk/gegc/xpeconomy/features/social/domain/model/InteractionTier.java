package uk.gegc.xpeconomy.features.social.domain.model;

import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;

/**
 * Reactions a reader can attach to someone else's comment. Reports mirror the positive tiers in
 * severity and cost but never reward or penalize the author.
 */
public enum InteractionTier {
    BRONZE(1, true),
    SILVER(2, true),
    GOLD(3, true),
    REPORT_TROLL(1, false),
    REPORT_BAD(2, false),
    REPORT_ABUSIVE(3, false);

    private final int severity;
    private final boolean positive;

    InteractionTier(int severity, boolean positive) {
        this.severity = severity;
        this.positive = positive;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isPositive() {
        return positive;
    }

    public XpTransactionSource spendSource() {
        return positive ? XpTransactionSource.INTERACTION : XpTransactionSource.REPORT;
    }
}

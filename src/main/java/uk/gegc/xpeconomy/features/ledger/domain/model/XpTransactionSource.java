package uk.gegc.xpeconomy.features.ledger.domain.model;

/**
 * Category of an XP movement. Each category belongs to exactly one direction,
 * so a spend can never be booked under an earning source and vice versa.
 */
public enum XpTransactionSource {
    QUIZ_COMPLETION(XpTransactionType.EARN),
    SPEED_PROGRESSION(XpTransactionType.EARN),
    READING_STREAK(XpTransactionType.EARN),
    INTERACTION_REWARD(XpTransactionType.EARN),
    ADMIN_ADJUSTMENT(XpTransactionType.EARN),

    COMMENT_POST(XpTransactionType.SPEND),
    COMMENT_REPLY(XpTransactionType.SPEND),
    INTERACTION(XpTransactionType.SPEND),
    REPORT(XpTransactionType.SPEND),
    FEATURE_PURCHASE(XpTransactionType.SPEND),
    BUNDLE_PURCHASE(XpTransactionType.SPEND);

    private final XpTransactionType direction;

    XpTransactionSource(XpTransactionType direction) {
        this.direction = direction;
    }

    public XpTransactionType getDirection() {
        return direction;
    }
}

package uk.gegc.xpeconomy.features.ledger.domain.model;

public enum XpTransactionType {
    EARN,
    SPEND
}

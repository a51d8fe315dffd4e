package uk.gegc.xpeconomy.features.monitoring.domain.model;

public enum ReviewFlagType {
    /** Spendable balance below zero. */
    NEGATIVE_BALANCE,
    /** Stored spendable balance differs from the ledger sum or the last entry's balance. */
    BALANCE_DRIFT,
    /** Stored accumulated XP differs from the sum of EARN entries. */
    ACCUMULATED_DRIFT,
    /** Earned more than the configured amount inside the velocity window. */
    XP_VELOCITY
}

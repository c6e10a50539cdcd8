package com.flagship.split_ledger.settlement;

/**
 * Which balance a settlement is computed from.
 */
public enum SettlementBasis {
    /**
     * Paid minus consumed. Sums to zero across participants.
     */
    NET,

    /**
     * Net plus earned cashback. Does not sum to zero when any cashback was
     * earned, so part of the credit side is left unmatched.
     */
    NET_AFTER_CASHBACK
}

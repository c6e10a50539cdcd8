package com.flagship.split_ledger.ledger;

import lombok.Value;

/**
 * Per-participant totals over a date window.
 * Derived on demand, never stored.
 *
 * Positive net means the participant is owed money; negative means they owe.
 */
@Value
public class SummaryEntry {
    double paid;
    double consumed;
    double net;
    double cashback;
    double netAfterCashback;

    public static SummaryEntry of(double paid, double consumed, double cashback) {
        double net = paid - consumed;
        return new SummaryEntry(paid, consumed, net, cashback, net + cashback);
    }
}

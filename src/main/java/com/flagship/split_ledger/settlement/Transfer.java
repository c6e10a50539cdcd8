package com.flagship.split_ledger.settlement;

import lombok.Value;

/**
 * Suggested payment from a debtor to a creditor. Amount is always positive.
 */
@Value
public class Transfer {
    String debtor;
    String creditor;
    double amount;
}

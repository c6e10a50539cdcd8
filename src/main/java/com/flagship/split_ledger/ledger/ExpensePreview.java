package com.flagship.split_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Live breakdown of a draft record before it is added to a ledger.
 */
@Value
@Builder
public class ExpensePreview {
    double amount;
    double cashbackRate;
    double cashback;
    /** 1 - rate when cashback is applied as a discount, otherwise 1. */
    double multiplier;
    double splitBase;
    Map<String, Double> shares;
    Map<String, Double> costs;
}

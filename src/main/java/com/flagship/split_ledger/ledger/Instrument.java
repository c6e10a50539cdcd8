package com.flagship.split_ledger.ledger;

import lombok.Value;

/**
 * Payment instrument (a card) with the fraction of each charge returned to the payer.
 */
@Value
public class Instrument {
    String name;
    double cashbackRate;
}

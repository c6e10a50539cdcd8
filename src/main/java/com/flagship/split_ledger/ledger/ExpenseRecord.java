package com.flagship.split_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * A single shared expense: paid in full by one participant, consumed by
 * several in proportion to raw allocation shares.
 *
 * Raw shares need not sum to 1, need not cover every participant and may
 * name participants that have since left the ledger. They are normalized
 * against the current participant set whenever the record is aggregated.
 *
 * Merchant, item and notes are descriptive only.
 */
@Value
@Builder(toBuilder = true)
public class ExpenseRecord {
    String id;
    LocalDate date;
    String payer;
    String instrument;
    String merchant;
    String item;
    double amount;
    @Singular("allocation")
    Map<String, Double> allocations;
    String notes;

    /**
     * Returns a copy of this record carrying the given raw allocations.
     */
    public ExpenseRecord withAllocations(Map<String, Double> newAllocations) {
        return toBuilder()
            .clearAllocations()
            .allocations(newAllocations == null ? Map.of() : newAllocations)
            .build();
    }

    /**
     * Returns a copy of this record charged to a different instrument.
     */
    public ExpenseRecord withInstrument(String newInstrument) {
        return toBuilder().instrument(newInstrument).build();
    }
}

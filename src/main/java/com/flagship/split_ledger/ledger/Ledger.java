package com.flagship.split_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a shared-expense ledger.
 *
 * The participant list is ordered and unique. Instruments are looked up by
 * name; records may reference instruments that no longer exist, which then
 * resolve to a cashback rate of zero.
 *
 * When {@code applyCashbackAsDiscount} is set, the cashback earned on a
 * record is deducted before the amount is split among consumers. Otherwise
 * the full amount is split and cashback is tracked as a separate reward.
 */
@Value
@Builder(toBuilder = true)
public class Ledger {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int version = CURRENT_VERSION;
    @Singular("participant")
    List<String> participants;
    @Singular("instrument")
    List<Instrument> instruments;
    @Singular("expense")
    List<ExpenseRecord> expenses;
    @Builder.Default
    boolean applyCashbackAsDiscount = true;

    public static Ledger empty() {
        return Ledger.builder().build();
    }

    /**
     * Cashback rate per instrument name. A later duplicate name overrides an earlier one.
     */
    public Map<String, Double> instrumentRates() {
        Map<String, Double> rates = new HashMap<>();
        for (Instrument instrument : instruments) {
            rates.put(instrument.getName(), instrument.getCashbackRate());
        }
        return rates;
    }

    /**
     * Cashback rate of the named instrument, or 0.0 if it is unknown.
     */
    public double cashbackRateOf(String instrumentName) {
        if (instrumentName == null) {
            return 0.0;
        }
        return instrumentRates().getOrDefault(instrumentName, 0.0);
    }

    public boolean hasParticipant(String name) {
        return participants.contains(name);
    }

    public boolean hasInstrument(String name) {
        return instruments.stream().anyMatch(i -> Objects.equals(i.getName(), name));
    }
}

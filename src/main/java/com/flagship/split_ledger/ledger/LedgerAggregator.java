package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates paid, consumed and cashback totals per participant.
 *
 * For every record inside the date window:
 * - the payer is credited the full amount and the cashback it earned
 * - the split base is distributed over the current participants using
 *   the record's normalized allocations
 *
 * Data drift is tolerated, never rejected. An unknown instrument earns no
 * cashback. A payer who is no longer a participant contributes nothing to
 * paid or cashback, while the record's consumption is still split among the
 * current participants.
 *
 * Reads the ledger only; every call returns fresh values.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerAggregator {

    private final AllocationNormalizer normalizer;

    public Map<String, SummaryEntry> summarize(Ledger ledger, LocalDate start, LocalDate end) {
        return summarize(ledger, DateWindow.between(start, end));
    }

    /**
     * Computes the summary for every current participant, keyed in participant order.
     *
     * @param ledger ledger snapshot
     * @param window inclusive date window
     * @return unmodifiable summary per participant
     */
    public Map<String, SummaryEntry> summarize(Ledger ledger, DateWindow window) {
        List<String> participants = AllocationNormalizer.distinct(ledger.getParticipants());
        Map<String, Double> rates = ledger.instrumentRates();

        Map<String, Double> paid = zeroed(participants);
        Map<String, Double> consumed = zeroed(participants);
        Map<String, Double> cashback = zeroed(participants);

        for (ExpenseRecord record : filter(ledger, window)) {
            double rate = rates.getOrDefault(record.getInstrument(), 0.0);
            if (record.getInstrument() != null && !rates.containsKey(record.getInstrument())) {
                log.debug("Unknown instrument, no cashback applied: recordId={}, instrument={}",
                        record.getId(), record.getInstrument());
            }

            double base = splitBase(record.getAmount(), rate, ledger.isApplyCashbackAsDiscount());
            Map<String, Double> shares = normalizer.normalize(record.getAllocations(), participants);
            for (String participant : participants) {
                consumed.merge(participant, base * shares.get(participant), Double::sum);
            }

            if (paid.containsKey(record.getPayer())) {
                paid.merge(record.getPayer(), record.getAmount(), Double::sum);
                cashback.merge(record.getPayer(), cashbackOf(record.getAmount(), rate), Double::sum);
            } else {
                log.debug("Payer is not a current participant, paid and cashback dropped: recordId={}, payer={}",
                        record.getId(), record.getPayer());
            }
        }

        Map<String, SummaryEntry> summary = new LinkedHashMap<>();
        for (String participant : participants) {
            summary.put(participant, SummaryEntry.of(
                    paid.get(participant), consumed.get(participant), cashback.get(participant)));
        }
        return Collections.unmodifiableMap(summary);
    }

    /**
     * Net balance (paid minus consumed) per participant.
     */
    public static Map<String, Double> netBalances(Map<String, SummaryEntry> summary) {
        Map<String, Double> net = new LinkedHashMap<>();
        summary.forEach((participant, entry) -> net.put(participant, entry.getNet()));
        return net;
    }

    /**
     * Net balance plus earned cashback per participant.
     */
    public static Map<String, Double> netAfterCashbackBalances(Map<String, SummaryEntry> summary) {
        Map<String, Double> net = new LinkedHashMap<>();
        summary.forEach((participant, entry) -> net.put(participant, entry.getNetAfterCashback()));
        return net;
    }

    /**
     * Records whose date falls inside the window, in ledger order.
     * A record without a date only passes an unbounded window.
     */
    public List<ExpenseRecord> filter(Ledger ledger, DateWindow window) {
        return ledger.getExpenses().stream()
            .filter(record -> record.getDate() == null
                    ? window.isUnbounded()
                    : window.contains(record.getDate()))
            .toList();
    }

    /**
     * Amount divided among consumers: the charge net of cashback when
     * cashback is applied as a discount, otherwise the full charge.
     */
    public static double splitBase(double amount, double rate, boolean applyCashbackAsDiscount) {
        return applyCashbackAsDiscount ? amount * (1.0 - rate) : amount;
    }

    public static double cashbackOf(double amount, double rate) {
        return amount * rate;
    }

    private static Map<String, Double> zeroed(List<String> participants) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (String participant : participants) {
            totals.put(participant, 0.0);
        }
        return totals;
    }
}

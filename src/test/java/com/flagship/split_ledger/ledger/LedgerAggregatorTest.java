package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Ledger aggregation
 *
 * These tests verify that:
 * - Each record's split base is fully partitioned among participants
 * - Money is conserved (net balances sum to zero)
 * - Date windows are inclusive and compare calendar dates
 * - Data drift (unknown instruments, removed payers) is tolerated
 */
class LedgerAggregatorTest {

    private static final double TOLERANCE = 1e-6;

    private final LedgerAggregator aggregator = new LedgerAggregator(new AllocationNormalizer());

    @Test
    @DisplayName("Cashback as discount: split base is amount net of cashback")
    void testCashbackAsDiscount() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B")
            .instrument(new Instrument("Card20", 0.2))
            .expense(record("e1", "2024-03-01", "A", "Card20", 100.0, Map.of("A", 1.0, "B", 1.0)))
            .applyCashbackAsDiscount(true)
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(40.0, summary.get("A").getConsumed(), TOLERANCE);
        assertEquals(40.0, summary.get("B").getConsumed(), TOLERANCE);
        assertEquals(100.0, summary.get("A").getPaid(), TOLERANCE);
        assertEquals(0.0, summary.get("B").getPaid(), TOLERANCE);
        assertEquals(16.0, summary.get("A").getCashback(), TOLERANCE);
        assertEquals(0.0, summary.get("B").getCashback(), TOLERANCE);
        assertEquals(60.0, summary.get("A").getNet(), TOLERANCE);
        assertEquals(76.0, summary.get("A").getNetAfterCashback(), TOLERANCE);
        assertEquals(-40.0, summary.get("B").getNet(), TOLERANCE);
    }

    @Test
    @DisplayName("Cashback as separate reward: full amount is split")
    void testCashbackAsReward() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B")
            .instrument(new Instrument("Card20", 0.2))
            .expense(record("e1", "2024-03-01", "A", "Card20", 100.0, Map.of("A", 1.0, "B", 1.0)))
            .applyCashbackAsDiscount(false)
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(50.0, summary.get("A").getConsumed(), TOLERANCE);
        assertEquals(50.0, summary.get("B").getConsumed(), TOLERANCE);
        assertEquals(20.0, summary.get("A").getCashback(), TOLERANCE);
        assertEquals(50.0, summary.get("A").getNet(), TOLERANCE);
        assertEquals(70.0, summary.get("A").getNetAfterCashback(), TOLERANCE);
    }

    private static Ledger mixedLedger(boolean discount) {
        return Ledger.builder()
            .participant("A").participant("B").participant("C")
            .instrument(new Instrument("Card6", 0.06))
            .expense(record("e1", "2024-01-05", "A", "Card6", 87.31, Map.of("A", 2.0, "C", 1.0)))
            .expense(record("e2", "2024-01-06", "B", "Cash", 19.99, Map.of()))
            .expense(record("e3", "2024-01-07", "C", "Card6", 240.0, Map.of("A", 0.2, "B", 0.5, "C", 0.3)))
            .expense(record("e4", "2024-01-08", "A", null, 3.5, Map.of("B", -1.0, "Gone", 4.0)))
            .applyCashbackAsDiscount(discount)
            .build();
    }

    @Test
    @DisplayName("Net balances sum to zero when cashback is a separate reward")
    void testConservation() {
        Map<String, SummaryEntry> summary = aggregator.summarize(mixedLedger(false), DateWindow.unbounded());

        double netTotal = summary.values().stream().mapToDouble(SummaryEntry::getNet).sum();
        assertEquals(0.0, netTotal, TOLERANCE);
    }

    @Test
    @DisplayName("With cashback as discount, net balances sum to the cashback earned")
    void testConservationWithDiscount() {
        Map<String, SummaryEntry> summary = aggregator.summarize(mixedLedger(true), DateWindow.unbounded());

        double netTotal = summary.values().stream().mapToDouble(SummaryEntry::getNet).sum();
        double cashbackTotal = summary.values().stream().mapToDouble(SummaryEntry::getCashback).sum();
        assertEquals((87.31 + 240.0) * 0.06, cashbackTotal, TOLERANCE);
        assertEquals(cashbackTotal, netTotal, TOLERANCE);
    }

    @Test
    @DisplayName("Each record's consumption partitions its split base")
    void testConsumptionPartition() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B").participant("C")
            .instrument(new Instrument("Card5", 0.05))
            .expense(record("e1", "2024-02-01", "B", "Card5", 61.0, Map.of("A", 3.0, "B", 1.0, "C", 2.0)))
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        double consumedTotal = summary.values().stream().mapToDouble(SummaryEntry::getConsumed).sum();
        assertEquals(61.0 * 0.95, consumedTotal, TOLERANCE);
        assertEquals(61.0 * 0.95 * 0.5, summary.get("A").getConsumed(), TOLERANCE);
    }

    @Test
    @DisplayName("Date window is inclusive at both ends")
    void testInclusiveWindow() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B")
            .expense(record("before", "2024-01-31", "A", null, 1000.0, Map.of()))
            .expense(record("first", "2024-02-01", "A", null, 10.0, Map.of()))
            .expense(record("last", "2024-02-29", "A", null, 20.0, Map.of()))
            .expense(record("after", "2024-03-01", "A", null, 1000.0, Map.of()))
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(
            ledger, LocalDate.parse("2024-02-01"), LocalDate.parse("2024-02-29"));

        assertEquals(30.0, summary.get("A").getPaid(), TOLERANCE);
        assertEquals(15.0, summary.get("B").getConsumed(), TOLERANCE);
    }

    @Test
    @DisplayName("Open-ended windows include everything on the open side")
    void testOpenEndedWindows() {
        Ledger ledger = Ledger.builder()
            .participant("A")
            .expense(record("e1", "1999-12-31", "A", null, 1.0, Map.of()))
            .expense(record("e2", "2024-06-15", "A", null, 2.0, Map.of()))
            .expense(record("e3", "2031-01-01", "A", null, 4.0, Map.of()))
            .build();

        assertEquals(3.0, aggregator.summarize(ledger, null, LocalDate.parse("2024-06-15"))
            .get("A").getPaid(), TOLERANCE);
        assertEquals(6.0, aggregator.summarize(ledger, LocalDate.parse("2024-06-15"), null)
            .get("A").getPaid(), TOLERANCE);
        assertEquals(7.0, aggregator.summarize(ledger, null, null)
            .get("A").getPaid(), TOLERANCE);
    }

    @Test
    @DisplayName("Records without a date are only counted in an unbounded window")
    void testUndatedRecord() {
        Ledger ledger = Ledger.builder()
            .participant("A")
            .expense(ExpenseRecord.builder().id("x").payer("A").amount(5.0).build())
            .build();

        assertEquals(5.0, aggregator.summarize(ledger, DateWindow.unbounded()).get("A").getPaid(), TOLERANCE);
        assertEquals(0.0, aggregator.summarize(ledger, LocalDate.parse("2024-01-01"), null)
            .get("A").getPaid(), TOLERANCE);
    }

    @Test
    @DisplayName("Unknown instrument earns no cashback and no discount")
    void testUnknownInstrument() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B")
            .instrument(new Instrument("Card20", 0.2))
            .expense(record("e1", "2024-03-01", "A", "Retired Card", 100.0, Map.of()))
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(0.0, summary.get("A").getCashback(), TOLERANCE);
        assertEquals(50.0, summary.get("B").getConsumed(), TOLERANCE);
    }

    @Test
    @DisplayName("Removed payer: paid and cashback dropped, consumption still split")
    void testRemovedPayer() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("B")
            .instrument(new Instrument("Card10", 0.1))
            .expense(record("e1", "2024-03-01", "Gone", "Card10", 100.0, Map.of("A", 1.0, "Gone", 1.0)))
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(0.0, summary.get("A").getPaid(), TOLERANCE);
        assertEquals(0.0, summary.get("B").getPaid(), TOLERANCE);
        assertEquals(0.0, summary.get("A").getCashback(), TOLERANCE);
        assertEquals(90.0, summary.get("A").getConsumed(), TOLERANCE);
        assertEquals(0.0, summary.get("B").getConsumed(), TOLERANCE);
        assertFalse(summary.containsKey("Gone"));
    }

    @Test
    @DisplayName("Empty ledger yields zeroed entries for every participant")
    void testEmptyLedger() {
        Ledger ledger = Ledger.builder().participant("A").participant("B").build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(List.of("A", "B"), List.copyOf(summary.keySet()));
        assertEquals(SummaryEntry.of(0.0, 0.0, 0.0), summary.get("A"));
    }

    @Test
    @DisplayName("No participants yields an empty summary without failing")
    void testNoParticipants() {
        Ledger ledger = Ledger.builder()
            .expense(record("e1", "2024-03-01", "A", null, 10.0, Map.of("A", 1.0)))
            .build();

        assertTrue(aggregator.summarize(ledger, DateWindow.unbounded()).isEmpty());
    }

    @Test
    @DisplayName("A participant listed twice is summarized once")
    void testRepeatedParticipant() {
        Ledger ledger = Ledger.builder()
            .participant("A").participant("A").participant("B")
            .expense(record("e1", "2024-03-01", "A", null, 90.0, Map.of("A", 1.0, "B", 1.0)))
            .build();

        Map<String, SummaryEntry> summary = aggregator.summarize(ledger, DateWindow.unbounded());

        assertEquals(List.of("A", "B"), List.copyOf(summary.keySet()));
        assertEquals(45.0, summary.get("A").getConsumed(), TOLERANCE);
        assertEquals(45.0, summary.get("B").getConsumed(), TOLERANCE);
        assertEquals(90.0, summary.get("A").getPaid(), TOLERANCE);
        assertEquals(0.0, LedgerAggregator.netBalances(summary).values().stream()
            .mapToDouble(Double::doubleValue).sum(), TOLERANCE);
    }

    @Test
    @DisplayName("Net balance helpers follow summary order")
    void testNetBalanceHelpers() {
        Map<String, SummaryEntry> summary = Map.of("A", SummaryEntry.of(10.0, 4.0, 1.0));

        assertEquals(6.0, LedgerAggregator.netBalances(summary).get("A"), TOLERANCE);
        assertEquals(7.0, LedgerAggregator.netAfterCashbackBalances(summary).get("A"), TOLERANCE);
    }

    static ExpenseRecord record(String id, String date, String payer, String instrument,
                                double amount, Map<String, Double> allocations) {
        return ExpenseRecord.builder()
            .id(id)
            .date(LocalDate.parse(date))
            .payer(payer)
            .instrument(instrument)
            .merchant("Market")
            .item(id)
            .amount(amount)
            .allocations(allocations)
            .build();
    }
}

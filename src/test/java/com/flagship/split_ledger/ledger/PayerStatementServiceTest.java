package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Per-payer statements
 */
class PayerStatementServiceTest {

    private static final double TOLERANCE = 1e-9;

    private final AllocationNormalizer normalizer = new AllocationNormalizer();
    private final PayerStatementService statementService =
        new PayerStatementService(normalizer, new LedgerAggregator(normalizer));

    private static ExpenseRecord purchase(String id, String date, String payer, String merchant,
                                          String instrument, String item, double amount,
                                          Map<String, Double> allocations) {
        return ExpenseRecord.builder()
            .id(id)
            .date(LocalDate.parse(date))
            .payer(payer)
            .merchant(merchant)
            .instrument(instrument)
            .item(item)
            .amount(amount)
            .allocations(allocations)
            .build();
    }

    @Test
    @DisplayName("Records are grouped by date, merchant and instrument in sorted order")
    void testGrouping() {
        Ledger ledger = Ledger.builder()
            .participant("Zoe").participant("Ann")
            .instrument(new Instrument("Card6", 0.06))
            .expense(purchase("3", "2024-04-02", "Zoe", "Bakery", "Card6", "bread", 5.0, Map.of()))
            .expense(purchase("2", "2024-04-01", "Zoe", "Grocer", "Card6", "milk", 4.0, Map.of("Zoe", 1.0)))
            .expense(purchase("1", "2024-04-01", "Zoe", "Grocer", "Card6", "eggs", 6.0, Map.of("Ann", 1.0)))
            .build();

        List<PayerStatement> statements = statementService.statements(ledger, DateWindow.unbounded());

        assertEquals(1, statements.size());
        PayerStatement statement = statements.get(0);
        assertEquals("Zoe", statement.getPayer());
        assertEquals(2, statement.getGroups().size());

        PayerStatement.Group grocer = statement.getGroups().get(0);
        assertEquals("Grocer", grocer.getMerchant());
        assertEquals(0.94, grocer.getMultiplier(), TOLERANCE);
        assertEquals(List.of("eggs", "milk"),
            grocer.getLines().stream().map(PayerStatement.Line::getItem).toList());
        assertEquals(6.0 * 0.94, grocer.getLines().get(0).getCosts().get("Ann"), TOLERANCE);

        assertEquals("Bakery", statement.getGroups().get(1).getMerchant());
        assertEquals(15.0 * 0.94, statement.getTotalSplitBase(), TOLERANCE);
        assertEquals(statement.getTotalSplitBase(),
            statement.getTotalCosts().values().stream().mapToDouble(Double::doubleValue).sum(), TOLERANCE);
    }

    @Test
    @DisplayName("Payers are sorted by name and limited to current participants")
    void testPayersSortedAndCurrent() {
        Ledger ledger = Ledger.builder()
            .participant("Zoe").participant("Ann")
            .expense(purchase("1", "2024-04-01", "Zoe", "M", null, "x", 1.0, Map.of()))
            .expense(purchase("2", "2024-04-01", "Ann", "M", null, "y", 1.0, Map.of()))
            .expense(purchase("3", "2024-04-01", "Gone", "M", null, "z", 1.0, Map.of()))
            .build();

        List<PayerStatement> statements = statementService.statements(ledger, DateWindow.unbounded());

        assertEquals(List.of("Ann", "Zoe"), statements.stream().map(PayerStatement::getPayer).toList());
    }

    @Test
    @DisplayName("Without in-window payers every participant gets an empty statement")
    void testNoPayersInWindow() {
        Ledger ledger = Ledger.builder()
            .participant("Zoe").participant("Ann")
            .expense(purchase("1", "2023-01-01", "Zoe", "M", null, "x", 1.0, Map.of()))
            .build();

        List<PayerStatement> statements = statementService.statements(
            ledger, DateWindow.between(LocalDate.parse("2024-01-01"), null));

        assertEquals(List.of("Ann", "Zoe"), statements.stream().map(PayerStatement::getPayer).toList());
        statements.forEach(statement -> {
            assertTrue(statement.getGroups().isEmpty());
            assertEquals(0.0, statement.getTotalSplitBase(), TOLERANCE);
        });
    }
}

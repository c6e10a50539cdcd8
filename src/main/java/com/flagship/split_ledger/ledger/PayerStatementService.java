package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Builds one statement per payer listing the records they paid for.
 *
 * Payers are the current participants who paid at least one record in the
 * window, sorted by name. When no record in the window has a current
 * participant as payer, every participant gets a (possibly empty) statement.
 *
 * Within a statement, records are ordered by date, merchant, instrument and
 * item, and consecutive records sharing date, merchant and instrument form
 * one group.
 */
@Service
@RequiredArgsConstructor
public class PayerStatementService {

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<ExpenseRecord> STATEMENT_ORDER =
        Comparator.comparing(ExpenseRecord::getDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(ExpenseRecord::getMerchant, TEXT)
            .thenComparing(ExpenseRecord::getInstrument, TEXT)
            .thenComparing(ExpenseRecord::getItem, TEXT);

    private final AllocationNormalizer normalizer;
    private final LedgerAggregator aggregator;

    public List<PayerStatement> statements(Ledger ledger, DateWindow window) {
        List<ExpenseRecord> records = aggregator.filter(ledger, window);

        TreeSet<String> payers = new TreeSet<>();
        for (ExpenseRecord record : records) {
            if (ledger.hasParticipant(record.getPayer())) {
                payers.add(record.getPayer());
            }
        }
        if (payers.isEmpty()) {
            payers.addAll(ledger.getParticipants());
        }

        List<PayerStatement> statements = new ArrayList<>();
        for (String payer : payers) {
            List<ExpenseRecord> paidBy = records.stream()
                .filter(record -> payer.equals(record.getPayer()))
                .sorted(STATEMENT_ORDER)
                .toList();
            statements.add(statementFor(ledger, payer, paidBy));
        }
        return List.copyOf(statements);
    }

    private PayerStatement statementFor(Ledger ledger, String payer, List<ExpenseRecord> records) {
        List<String> participants = AllocationNormalizer.distinct(ledger.getParticipants());
        Map<String, Double> rates = ledger.instrumentRates();
        boolean discount = ledger.isApplyCashbackAsDiscount();

        List<PayerStatement.Group> groups = new ArrayList<>();
        List<PayerStatement.Line> lines = new ArrayList<>();
        ExpenseRecord groupHead = null;
        double totalBase = 0.0;
        Map<String, Double> totalCosts = new LinkedHashMap<>();
        participants.forEach(p -> totalCosts.put(p, 0.0));

        for (ExpenseRecord record : records) {
            if (groupHead != null && !sameGroup(groupHead, record)) {
                groups.add(group(groupHead, rates, discount, lines));
                lines = new ArrayList<>();
            }
            if (lines.isEmpty()) {
                groupHead = record;
            }

            double rate = rates.getOrDefault(record.getInstrument(), 0.0);
            double base = LedgerAggregator.splitBase(record.getAmount(), rate, discount);
            Map<String, Double> shares = normalizer.normalize(record.getAllocations(), participants);
            Map<String, Double> costs = new LinkedHashMap<>();
            for (String participant : participants) {
                double cost = base * shares.get(participant);
                costs.put(participant, cost);
                totalCosts.merge(participant, cost, Double::sum);
            }
            totalBase += base;

            lines.add(PayerStatement.Line.builder()
                .recordId(record.getId())
                .item(record.getItem())
                .splitBase(base)
                .shares(shares)
                .costs(Collections.unmodifiableMap(costs))
                .build());
        }
        if (groupHead != null) {
            groups.add(group(groupHead, rates, discount, lines));
        }

        return PayerStatement.builder()
            .payer(payer)
            .groups(List.copyOf(groups))
            .totalSplitBase(totalBase)
            .totalCosts(Collections.unmodifiableMap(totalCosts))
            .build();
    }

    private static PayerStatement.Group group(ExpenseRecord head, Map<String, Double> rates,
                                              boolean discount, List<PayerStatement.Line> lines) {
        double rate = rates.getOrDefault(head.getInstrument(), 0.0);
        return PayerStatement.Group.builder()
            .date(head.getDate())
            .merchant(head.getMerchant())
            .instrument(head.getInstrument())
            .cashbackRate(rate)
            .multiplier(discount ? 1.0 - rate : 1.0)
            .lines(List.copyOf(lines))
            .build();
    }

    private static boolean sameGroup(ExpenseRecord a, ExpenseRecord b) {
        return Objects.equals(a.getDate(), b.getDate())
            && Objects.equals(a.getMerchant(), b.getMerchant())
            && Objects.equals(a.getInstrument(), b.getInstrument());
    }
}

package com.flagship.split_ledger.report;

import com.flagship.split_ledger.config.SettlementProperties;
import com.flagship.split_ledger.ledger.DateWindow;
import com.flagship.split_ledger.ledger.Ledger;
import com.flagship.split_ledger.ledger.LedgerAggregator;
import com.flagship.split_ledger.ledger.PayerStatement;
import com.flagship.split_ledger.ledger.PayerStatementService;
import com.flagship.split_ledger.ledger.SummaryEntry;
import com.flagship.split_ledger.observability.CorrelationIdFilter;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.SettlementBasis;
import com.flagship.split_ledger.settlement.SettlementReducer;
import com.flagship.split_ledger.settlement.Transfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Produces ledger reports: per-participant summary plus the transfers that
 * settle it.
 *
 * Pipeline: date filter, per-record normalized allocation, per-participant
 * aggregation, net balances, greedy settlement. Each step is pure; this
 * service only chooses the balance to settle on and records metrics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReportService {

    private final LedgerAggregator aggregator;
    private final SettlementReducer reducer;
    private final PayerStatementService statementService;
    private final SettlementProperties settlementProperties;
    private final LedgerMetrics metrics;

    /**
     * Generates a report.
     *
     * @param ledger ledger snapshot
     * @param window inclusive date window
     * @param requestedBasis balance to settle on; configured default when null
     * @param requestedEpsilon settlement tolerance; configured default when null
     * @return the report
     */
    public LedgerReport generate(Ledger ledger, DateWindow window,
                                 SettlementBasis requestedBasis, Double requestedEpsilon) {
        long startTime = System.currentTimeMillis();
        SettlementBasis basis = settlementProperties.resolve(requestedBasis);
        double epsilon = requestedEpsilon != null ? requestedEpsilon : reducer.getDefaultEpsilon();
        MDC.put(CorrelationIdFilter.LEDGER_VERSION_MDC_KEY, String.valueOf(ledger.getVersion()));

        try {
            int recordCount = aggregator.filter(ledger, window).size();
            Map<String, SummaryEntry> summary = aggregator.summarize(ledger, window);
            Map<String, Double> balances = basis == SettlementBasis.NET_AFTER_CASHBACK
                ? LedgerAggregator.netAfterCashbackBalances(summary)
                : LedgerAggregator.netBalances(summary);
            List<Transfer> transfers = reducer.settle(balances, epsilon);

            double totalPaid = 0.0;
            double totalConsumed = 0.0;
            double totalCashback = 0.0;
            for (SummaryEntry entry : summary.values()) {
                totalPaid += entry.getPaid();
                totalConsumed += entry.getConsumed();
                totalCashback += entry.getCashback();
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordReport(basis.name(), "success");
            metrics.recordTransfers(transfers.size());
            metrics.recordLatency("report", duration);

            log.info("Ledger report generated: participants={}, records={}, transfers={}, basis={}, duration={}ms",
                    summary.size(), recordCount, transfers.size(), basis, duration);

            return LedgerReport.builder()
                .window(window)
                .applyCashbackAsDiscount(ledger.isApplyCashbackAsDiscount())
                .basis(basis)
                .epsilon(epsilon)
                .recordCount(recordCount)
                .totalPaid(totalPaid)
                .totalConsumed(totalConsumed)
                .totalCashback(totalCashback)
                .summary(summary)
                .transfers(transfers)
                .build();

        } catch (RuntimeException e) {
            metrics.recordReport(basis.name(), "error");
            log.error("Ledger report failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationIdFilter.LEDGER_VERSION_MDC_KEY);
        }
    }

    public List<PayerStatement> statements(Ledger ledger, DateWindow window) {
        long startTime = System.currentTimeMillis();
        List<PayerStatement> statements = statementService.statements(ledger, window);
        metrics.recordLatency("statements", System.currentTimeMillis() - startTime);

        log.info("Payer statements generated: payers={}", statements.size());
        return statements;
    }

    /**
     * Settles arbitrary balances, e.g. ones adjusted by hand outside any ledger.
     */
    public List<Transfer> settle(Map<String, Double> balances, Double requestedEpsilon) {
        double epsilon = requestedEpsilon != null ? requestedEpsilon : reducer.getDefaultEpsilon();
        List<Transfer> transfers = reducer.settle(balances, epsilon);
        metrics.recordTransfers(transfers.size());

        log.info("Balances settled: participants={}, transfers={}", balances.size(), transfers.size());
        return transfers;
    }
}

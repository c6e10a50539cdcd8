package com.flagship.split_ledger.report;

import com.flagship.split_ledger.ledger.DateWindow;
import com.flagship.split_ledger.ledger.SummaryEntry;
import com.flagship.split_ledger.settlement.SettlementBasis;
import com.flagship.split_ledger.settlement.Transfer;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Summary and settlement of a ledger over a date window.
 */
@Value
@Builder
public class LedgerReport {
    DateWindow window;
    boolean applyCashbackAsDiscount;
    SettlementBasis basis;
    double epsilon;
    int recordCount;
    double totalPaid;
    double totalConsumed;
    double totalCashback;
    Map<String, SummaryEntry> summary;
    List<Transfer> transfers;
}

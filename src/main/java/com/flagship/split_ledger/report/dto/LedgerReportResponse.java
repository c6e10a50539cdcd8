package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.SummaryEntry;
import com.flagship.split_ledger.report.LedgerReport;
import com.flagship.split_ledger.settlement.SettlementBasis;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a ledger report. Summary rows follow participant order.
 */
@Value
@Builder
public class LedgerReportResponse {

    @JsonProperty("start")
    LocalDate start;

    @JsonProperty("end")
    LocalDate end;

    @JsonProperty("apply_cashback_as_discount")
    boolean applyCashbackAsDiscount;

    @JsonProperty("basis")
    SettlementBasis basis;

    @JsonProperty("epsilon")
    double epsilon;

    @JsonProperty("record_count")
    int recordCount;

    @JsonProperty("total_paid")
    double totalPaid;

    @JsonProperty("total_consumed")
    double totalConsumed;

    @JsonProperty("total_cashback")
    double totalCashback;

    @JsonProperty("summary")
    List<SummaryRow> summary;

    @JsonProperty("transfers")
    List<TransferResponse> transfers;

    @Value
    @Builder
    public static class SummaryRow {
        @JsonProperty("person")
        String participant;

        @JsonProperty("paid")
        double paid;

        @JsonProperty("consumed")
        double consumed;

        @JsonProperty("net")
        double net;

        @JsonProperty("cashback")
        double cashback;

        @JsonProperty("net_after_cashback")
        double netAfterCashback;
    }

    public static LedgerReportResponse from(LedgerReport report) {
        List<SummaryRow> rows = new ArrayList<>();
        for (Map.Entry<String, SummaryEntry> entry : report.getSummary().entrySet()) {
            SummaryEntry s = entry.getValue();
            rows.add(SummaryRow.builder()
                .participant(entry.getKey())
                .paid(s.getPaid())
                .consumed(s.getConsumed())
                .net(s.getNet())
                .cashback(s.getCashback())
                .netAfterCashback(s.getNetAfterCashback())
                .build());
        }

        return LedgerReportResponse.builder()
            .start(report.getWindow().getStart())
            .end(report.getWindow().getEnd())
            .applyCashbackAsDiscount(report.isApplyCashbackAsDiscount())
            .basis(report.getBasis())
            .epsilon(report.getEpsilon())
            .recordCount(report.getRecordCount())
            .totalPaid(report.getTotalPaid())
            .totalConsumed(report.getTotalConsumed())
            .totalCashback(report.getTotalCashback())
            .summary(rows)
            .transfers(report.getTransfers().stream().map(TransferResponse::from).toList())
            .build();
    }
}

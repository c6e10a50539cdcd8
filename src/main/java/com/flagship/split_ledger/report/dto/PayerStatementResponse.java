package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.PayerStatement;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for one payer's statement.
 */
@Value
@Builder
public class PayerStatementResponse {

    @JsonProperty("payer")
    String payer;

    @JsonProperty("groups")
    List<GroupResponse> groups;

    @JsonProperty("total_split_base")
    double totalSplitBase;

    @JsonProperty("total_costs")
    Map<String, Double> totalCosts;

    @Value
    @Builder
    public static class GroupResponse {
        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("merchant")
        String merchant;

        @JsonProperty("card")
        String instrument;

        @JsonProperty("cashback_rate")
        double cashbackRate;

        @JsonProperty("multiplier")
        double multiplier;

        @JsonProperty("lines")
        List<LineResponse> lines;
    }

    @Value
    @Builder
    public static class LineResponse {
        @JsonProperty("id")
        String recordId;

        @JsonProperty("item")
        String item;

        @JsonProperty("price")
        double splitBase;

        @JsonProperty("shares")
        Map<String, Double> shares;

        @JsonProperty("costs")
        Map<String, Double> costs;
    }

    public static PayerStatementResponse from(PayerStatement statement) {
        return PayerStatementResponse.builder()
            .payer(statement.getPayer())
            .groups(statement.getGroups().stream().map(PayerStatementResponse::group).toList())
            .totalSplitBase(statement.getTotalSplitBase())
            .totalCosts(statement.getTotalCosts())
            .build();
    }

    private static GroupResponse group(PayerStatement.Group group) {
        return GroupResponse.builder()
            .date(group.getDate())
            .merchant(group.getMerchant())
            .instrument(group.getInstrument())
            .cashbackRate(group.getCashbackRate())
            .multiplier(group.getMultiplier())
            .lines(group.getLines().stream()
                .map(line -> LineResponse.builder()
                    .recordId(line.getRecordId())
                    .item(line.getItem())
                    .splitBase(line.getSplitBase())
                    .shares(line.getShares())
                    .costs(line.getCosts())
                    .build())
                .toList())
            .build();
    }
}

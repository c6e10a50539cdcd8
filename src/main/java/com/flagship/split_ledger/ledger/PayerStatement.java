package com.flagship.split_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything one participant paid for inside a window, grouped by
 * purchase (date, merchant, instrument), with the cost each participant
 * bears per line and in total.
 */
@Value
@Builder
public class PayerStatement {
    String payer;
    List<Group> groups;
    double totalSplitBase;
    Map<String, Double> totalCosts;

    @Value
    @Builder
    public static class Group {
        LocalDate date;
        String merchant;
        String instrument;
        double cashbackRate;
        double multiplier;
        List<Line> lines;
    }

    @Value
    @Builder
    public static class Line {
        String recordId;
        String item;
        double splitBase;
        Map<String, Double> shares;
        Map<String, Double> costs;
    }
}

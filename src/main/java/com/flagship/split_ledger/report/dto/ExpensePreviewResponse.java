package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.ExpensePreview;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ExpensePreviewResponse {

    @JsonProperty("amount")
    double amount;

    @JsonProperty("cashback_rate")
    double cashbackRate;

    @JsonProperty("cashback")
    double cashback;

    @JsonProperty("multiplier")
    double multiplier;

    @JsonProperty("split_base")
    double splitBase;

    @JsonProperty("shares")
    Map<String, Double> shares;

    @JsonProperty("costs")
    Map<String, Double> costs;

    public static ExpensePreviewResponse from(ExpensePreview preview) {
        return ExpensePreviewResponse.builder()
            .amount(preview.getAmount())
            .cashbackRate(preview.getCashbackRate())
            .cashback(preview.getCashback())
            .multiplier(preview.getMultiplier())
            .splitBase(preview.getSplitBase())
            .shares(preview.getShares())
            .costs(preview.getCosts())
            .build();
    }
}

package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class SettlementRequest {

    @NotNull(message = "Balances are required")
    @JsonProperty("balances")
    Map<String, Double> balances;

    @PositiveOrZero(message = "Epsilon must not be negative")
    @JsonProperty("epsilon")
    Double epsilon;
}

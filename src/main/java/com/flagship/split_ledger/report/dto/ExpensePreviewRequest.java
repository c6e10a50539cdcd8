package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Request DTO for previewing a draft record against a ledger.
 */
@Value
@Builder
@Jacksonized
public class ExpensePreviewRequest {

    @Valid
    @NotNull(message = "Ledger is required")
    @JsonProperty("ledger")
    LedgerSnapshot ledger;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", message = "Amount must not be negative")
    @JsonProperty("amount")
    Double amount;

    @JsonProperty("card")
    String instrument;

    @JsonProperty("allocations")
    Map<String, Double> allocations;
}

package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.DateWindow;
import com.flagship.split_ledger.settlement.SettlementBasis;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Request DTO for a ledger report or payer statements.
 * Start and end are inclusive and optional.
 */
@Value
@Builder
@Jacksonized
public class ReportRequest {

    @Valid
    @NotNull(message = "Ledger is required")
    @JsonProperty("ledger")
    LedgerSnapshot ledger;

    @JsonProperty("start")
    LocalDate start;

    @JsonProperty("end")
    LocalDate end;

    @JsonProperty("basis")
    SettlementBasis basis;

    @PositiveOrZero(message = "Epsilon must not be negative")
    @JsonProperty("epsilon")
    Double epsilon;

    public DateWindow window() {
        return DateWindow.between(start, end);
    }
}
